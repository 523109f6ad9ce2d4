package com.signalgate.core.model;

/**
 * Approval decision of a signal. {@link #PENDING} is the only state that accepts a decision;
 * every other state is final.
 */
public enum ApprovalStatus {
    PENDING,
    APPROVED,
    AUTO_APPROVED,
    REJECTED;

    public boolean decided() {
        return this != PENDING;
    }

    public boolean dispatchable() {
        return this == APPROVED || this == AUTO_APPROVED;
    }
}
