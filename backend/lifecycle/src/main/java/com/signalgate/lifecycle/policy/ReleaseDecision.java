package com.signalgate.lifecycle.policy;

import java.util.Locale;

public record ReleaseDecision(boolean release, String reason, double remainingHours) {
    public static final String WEEKLY_LIMIT = "weekly limit";
    public static final String PREMIUM_ONLY = "premium-only";
    public static final String DELAY_REMAINING = "delay remaining";
    public static final String READY = "ready";

    public static ReleaseDecision send() {
        return new ReleaseDecision(true, READY, 0.0);
    }

    public static ReleaseDecision withhold(String reason) {
        return new ReleaseDecision(false, reason, 0.0);
    }

    public static ReleaseDecision delayed(double remainingHours) {
        return new ReleaseDecision(false, DELAY_REMAINING, remainingHours);
    }

    public String describe() {
        if (DELAY_REMAINING.equals(reason)) {
            return String.format(Locale.ROOT, "%s (%.1fh)", reason, remainingHours);
        }
        return reason;
    }
}
