package com.signalgate.lifecycle.dispatch;

public enum DeliveryOutcome {
    SENT,
    ALREADY_SENT,
    /** Another worker is sending the same signal to the same tier right now. */
    IN_FLIGHT,
    WITHHELD,
    NOT_ELIGIBLE,
    SKIPPED_UNCONFIGURED,
    FAILED
}
