package com.signalgate.core.events;

import java.time.Instant;

public record SchedulerTickStarted(Instant timestamp, long tickNumber) implements Event {
    @Override
    public String type() {
        return "SchedulerTickStarted";
    }
}
