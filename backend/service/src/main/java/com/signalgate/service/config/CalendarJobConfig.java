package com.signalgate.service.config;

import com.signalgate.core.model.Tier;
import com.signalgate.service.runtime.DigestKind;

import java.time.DayOfWeek;
import java.time.LocalTime;

/**
 * One calendar job. Weekly jobs set {@code dayOfWeek}; monthly jobs set {@code dayOfMonth}.
 */
public record CalendarJobConfig(
        String name,
        DigestKind kind,
        DayOfWeek dayOfWeek,
        Integer dayOfMonth,
        LocalTime time,
        Tier tier,
        Boolean enabled
) {
    public CalendarJobConfig {
        if (kind == null) {
            throw new IllegalArgumentException("calendar job kind is required");
        }
        name = name == null || name.isBlank() ? kind.defaultJobName() : name;
        time = time == null ? LocalTime.of(9, 0) : time;
        tier = tier == null ? Tier.FREE : tier;
        enabled = enabled == null ? Boolean.TRUE : enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }
}
