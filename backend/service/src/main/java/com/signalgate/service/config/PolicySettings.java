package com.signalgate.service.config;

import com.signalgate.core.model.SignalType;
import com.signalgate.lifecycle.config.SignalPolicyConfig;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * On-disk shape of {@code policy.json}. Every field is optional; absent values fall back to
 * {@link SignalPolicyConfig#defaults()}.
 */
public record PolicySettings(
        Double perKeywordWeight,
        Map<SignalType, Double> categoryBonuses,
        Double minPublishConfidence,
        Double autoApproveThreshold,
        Double freeTierThreshold,
        Double premiumTierThreshold,
        Integer freeDelayHours,
        Integer weeklyFreeCap,
        Duration recencyWindow,
        Duration releaseRetention,
        Integer maxPremiumAttempts,
        Duration premiumRetryWindow
) {
    public SignalPolicyConfig toConfig() {
        SignalPolicyConfig defaults = SignalPolicyConfig.defaults();
        Map<SignalType, Double> bonuses = new EnumMap<>(defaults.categoryBonuses());
        if (categoryBonuses != null) {
            bonuses.putAll(categoryBonuses);
        }
        return new SignalPolicyConfig(
                or(perKeywordWeight, defaults.perKeywordWeight()),
                bonuses,
                or(minPublishConfidence, defaults.minPublishConfidence()),
                or(autoApproveThreshold, defaults.autoApproveThreshold()),
                or(freeTierThreshold, defaults.freeTierThreshold()),
                or(premiumTierThreshold, defaults.premiumTierThreshold()),
                or(freeDelayHours, defaults.freeDelayHours()),
                or(weeklyFreeCap, defaults.weeklyFreeCap()),
                or(recencyWindow, defaults.recencyWindow()),
                or(releaseRetention, defaults.releaseRetention()),
                or(maxPremiumAttempts, defaults.maxPremiumAttempts()),
                or(premiumRetryWindow, defaults.premiumRetryWindow())
        );
    }

    private static <T> T or(T value, T fallback) {
        return value == null ? fallback : value;
    }
}
