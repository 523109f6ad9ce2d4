package com.signalgate.lifecycle.dispatch;

import com.signalgate.core.model.Signal;
import com.signalgate.lifecycle.policy.ReleaseDecision;

public record SignalPreview(
        Signal signal,
        String premiumMessage,
        String freeMessage,
        ReleaseDecision freeRelease
) {
}
