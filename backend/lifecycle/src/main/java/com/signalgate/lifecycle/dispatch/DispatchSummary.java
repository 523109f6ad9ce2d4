package com.signalgate.lifecycle.dispatch;

import com.signalgate.lifecycle.policy.ReleaseDecision;

public record DispatchSummary(DeliveryOutcome premium, DeliveryOutcome free, ReleaseDecision freeDecision) {
    public static DispatchSummary none() {
        return new DispatchSummary(DeliveryOutcome.NOT_ELIGIBLE, DeliveryOutcome.NOT_ELIGIBLE, null);
    }
}
