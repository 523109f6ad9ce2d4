package com.signalgate.lifecycle.config;

import com.signalgate.core.model.SignalType;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Thresholds and limits for scoring, tiering and release. Built once at startup and handed to every
 * component that needs it; nothing reads these values from the environment afterwards.
 */
public record SignalPolicyConfig(
        double perKeywordWeight,
        Map<SignalType, Double> categoryBonuses,
        double minPublishConfidence,
        double autoApproveThreshold,
        double freeTierThreshold,
        double premiumTierThreshold,
        int freeDelayHours,
        int weeklyFreeCap,
        Duration recencyWindow,
        Duration releaseRetention,
        int maxPremiumAttempts,
        Duration premiumRetryWindow
) {
    public SignalPolicyConfig {
        requireUnit("perKeywordWeight", perKeywordWeight);
        requireUnit("minPublishConfidence", minPublishConfidence);
        requireUnit("autoApproveThreshold", autoApproveThreshold);
        requireUnit("freeTierThreshold", freeTierThreshold);
        requireUnit("premiumTierThreshold", premiumTierThreshold);
        if (freeDelayHours < 0) {
            throw new IllegalArgumentException("freeDelayHours must not be negative");
        }
        if (weeklyFreeCap < 0) {
            throw new IllegalArgumentException("weeklyFreeCap must not be negative");
        }
        if (maxPremiumAttempts < 1) {
            throw new IllegalArgumentException("maxPremiumAttempts must be at least 1");
        }
        Objects.requireNonNull(recencyWindow, "recencyWindow is required");
        Objects.requireNonNull(releaseRetention, "releaseRetention is required");
        Objects.requireNonNull(premiumRetryWindow, "premiumRetryWindow is required");
        EnumMap<SignalType, Double> bonuses = new EnumMap<>(SignalType.class);
        bonuses.putAll(categoryBonuses == null ? defaultBonuses() : categoryBonuses);
        bonuses.putIfAbsent(SignalType.GENERAL, 0.0);
        categoryBonuses = Map.copyOf(bonuses);
    }

    public static SignalPolicyConfig defaults() {
        return new SignalPolicyConfig(
                0.06,
                defaultBonuses(),
                0.5,
                0.95,
                0.85,
                0.70,
                24,
                3,
                Duration.ofHours(4),
                Duration.ofDays(7),
                3,
                Duration.ofHours(6)
        );
    }

    public double bonusFor(SignalType type) {
        return categoryBonuses.getOrDefault(type, 0.0);
    }

    public SignalPolicyConfig withWeeklyFreeCap(int cap) {
        return new SignalPolicyConfig(perKeywordWeight, categoryBonuses, minPublishConfidence, autoApproveThreshold,
                freeTierThreshold, premiumTierThreshold, freeDelayHours, cap, recencyWindow, releaseRetention,
                maxPremiumAttempts, premiumRetryWindow);
    }

    public SignalPolicyConfig withFreeDelayHours(int hours) {
        return new SignalPolicyConfig(perKeywordWeight, categoryBonuses, minPublishConfidence, autoApproveThreshold,
                freeTierThreshold, premiumTierThreshold, hours, weeklyFreeCap, recencyWindow, releaseRetention,
                maxPremiumAttempts, premiumRetryWindow);
    }

    private static Map<SignalType, Double> defaultBonuses() {
        return Map.of(
                SignalType.ACQUISITION, 0.40,
                SignalType.IPO, 0.40,
                SignalType.FUNDING, 0.35,
                SignalType.INNOVATION, 0.25,
                SignalType.PRODUCT_LAUNCH, 0.20,
                SignalType.GENERAL, 0.0
        );
    }

    private static void requireUnit(String name, double value) {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be within [0,1]: " + value);
        }
    }
}
