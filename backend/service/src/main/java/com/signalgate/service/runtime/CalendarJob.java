package com.signalgate.service.runtime;

import com.signalgate.core.model.Tier;

import java.time.Instant;

public interface CalendarJob {
    String name();

    CalendarSchedule schedule();

    Tier tier();

    /**
     * Builds the message for the period containing {@code now}.
     */
    String compose(Instant now);
}
