package com.signalgate.service.config;

import java.time.ZoneId;
import java.util.List;

public record CalendarConfig(String zone, Integer digestSize, List<CalendarJobConfig> jobs) {
    public CalendarConfig {
        zone = zone == null || zone.isBlank() ? "UTC" : zone;
        digestSize = digestSize == null ? 5 : digestSize;
        if (digestSize < 1) {
            throw new IllegalArgumentException("digestSize must be at least 1");
        }
        jobs = jobs == null ? List.of() : List.copyOf(jobs);
    }

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }

    public List<CalendarJobConfig> enabledJobs() {
        return jobs.stream().filter(CalendarJobConfig::isEnabled).toList();
    }
}
