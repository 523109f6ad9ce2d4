package com.signalgate.service.runtime;

import com.signalgate.lifecycle.dispatch.ScanReport;
import com.signalgate.lifecycle.ingest.IngestReport;

import java.util.List;

public record TickReport(
        long tickNumber,
        boolean success,
        IngestReport ingest,
        List<String> failedFeeds,
        ScanReport freeReleases,
        ScanReport premiumRetries,
        List<String> calendarJobs
) {
    public TickReport {
        failedFeeds = List.copyOf(failedFeeds);
        calendarJobs = List.copyOf(calendarJobs);
    }
}
