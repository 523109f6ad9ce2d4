package com.signalgate.service.runtime;

import java.time.Duration;

public enum DigestKind {
    WEEKLY_DIGEST("Weekly Digest", "weekly-digest", Duration.ofDays(7), false),
    MIDWEEK_DIGEST("Midweek Update", "midweek-digest", Duration.ofDays(3), false),
    WEEKLY_QA("Weekly Q&A", "weekly-qa", Duration.ofDays(7), false),
    MONTHLY_DIGEST("Monthly Digest", "monthly-digest", null, true);

    private final String heading;
    private final String defaultJobName;
    private final Duration lookback;
    private final boolean monthly;

    DigestKind(String heading, String defaultJobName, Duration lookback, boolean monthly) {
        this.heading = heading;
        this.defaultJobName = defaultJobName;
        this.lookback = lookback;
        this.monthly = monthly;
    }

    public String heading() {
        return heading;
    }

    public String defaultJobName() {
        return defaultJobName;
    }

    /**
     * How far back a weekly-style digest looks. Monthly digests cover the calendar month instead.
     */
    public Duration lookback() {
        return lookback;
    }

    public boolean monthly() {
        return monthly;
    }
}
