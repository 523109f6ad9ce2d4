package com.signalgate.core.events;

import com.signalgate.core.model.ApprovalStatus;
import com.signalgate.core.model.TierAssignment;

import java.time.Instant;

public record SignalDecided(
        Instant timestamp,
        String signalId,
        ApprovalStatus approvalStatus,
        TierAssignment tierAssignment,
        String note
) implements Event {
    @Override
    public String type() {
        return "SignalDecided";
    }
}
