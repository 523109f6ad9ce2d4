package com.signalgate.core.events;

import java.time.Instant;

public record SchedulerTickCompleted(
        Instant timestamp,
        long tickNumber,
        boolean success,
        int signalsCreated,
        int freeReleases,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "SchedulerTickCompleted";
    }
}
