package com.signalgate.core.model;

import java.util.Locale;
import java.util.Optional;

public enum TierAssignment {
    PREMIUM,
    FREE,
    BOTH,
    NONE;

    public boolean includes(Tier tier) {
        return switch (tier) {
            case FREE -> this == FREE || this == BOTH;
            case PREMIUM -> this == PREMIUM || this == BOTH;
        };
    }

    /**
     * Parses an operator-supplied override. Only {@code premium}, {@code free} and {@code both} are accepted;
     * {@code none} cannot be chosen by hand.
     */
    public static Optional<TierAssignment> parseOverride(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "premium" -> Optional.of(PREMIUM);
            case "free" -> Optional.of(FREE);
            case "both" -> Optional.of(BOTH);
            default -> Optional.empty();
        };
    }
}
