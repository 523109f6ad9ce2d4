package com.signalgate.core.events;

import com.signalgate.core.model.Tier;

import java.time.Instant;

public record SignalDispatched(
        Instant timestamp,
        String signalId,
        Tier tier,
        String destination
) implements Event {
    @Override
    public String type() {
        return "SignalDispatched";
    }
}
