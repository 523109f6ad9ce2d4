package com.signalgate.lifecycle.ingest;

public record IngestReport(
        int received,
        int stale,
        int belowThreshold,
        int duplicates,
        int created,
        int autoApproved,
        int failed
) {
    public static IngestReport empty() {
        return new IngestReport(0, 0, 0, 0, 0, 0, 0);
    }

    public IngestReport plus(IngestReport other) {
        return new IngestReport(
                received + other.received,
                stale + other.stale,
                belowThreshold + other.belowThreshold,
                duplicates + other.duplicates,
                created + other.created,
                autoApproved + other.autoApproved,
                failed + other.failed
        );
    }
}
