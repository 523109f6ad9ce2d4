package com.signalgate.core.events;

import java.time.Instant;

public record CalendarJobCompleted(
        Instant timestamp,
        String jobName,
        String periodKey,
        boolean success
) implements Event {
    @Override
    public String type() {
        return "CalendarJobCompleted";
    }
}
