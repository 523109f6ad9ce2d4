package com.signalgate.core.events;

import com.signalgate.core.model.SignalType;
import com.signalgate.core.model.TierAssignment;

import java.time.Instant;

public record SignalCreated(
        Instant timestamp,
        String signalId,
        SignalType signalType,
        String source,
        double confidence,
        TierAssignment tierAssignment
) implements Event {
    @Override
    public String type() {
        return "SignalCreated";
    }
}
