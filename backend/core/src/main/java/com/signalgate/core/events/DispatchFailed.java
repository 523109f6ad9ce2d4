package com.signalgate.core.events;

import com.signalgate.core.model.Tier;

import java.time.Instant;

public record DispatchFailed(
        Instant timestamp,
        String signalId,
        Tier tier,
        String reason
) implements Event {
    @Override
    public String type() {
        return "DispatchFailed";
    }
}
