package com.signalgate.lifecycle.policy;

import com.signalgate.core.model.Signal;
import com.signalgate.core.model.Tier;
import com.signalgate.core.model.TierAssignment;
import com.signalgate.lifecycle.classify.KeywordVocabulary;
import com.signalgate.lifecycle.config.SignalPolicyConfig;
import com.signalgate.lifecycle.store.SignalRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Audience routing rules.
 *
 * <p>{@link #assignTier} runs once when a signal is created. {@link #shouldReleaseToFree} depends on the
 * weekly send counter read from the repository, so callers must ask again on every scan instead of
 * remembering an earlier answer.
 */
public class TierPolicy {
    public static final Duration WEEKLY_WINDOW = Duration.ofDays(7);

    private final SignalPolicyConfig config;
    private final SignalRepository repository;

    public TierPolicy(SignalPolicyConfig config, SignalRepository repository) {
        this.config = config;
        this.repository = repository;
    }

    public TierAssignment assignTier(Signal signal) {
        String text = signal.content() != null ? signal.content() : signal.title();
        return assignTier(text, signal.confidence());
    }

    public TierAssignment assignTier(String content, double confidence) {
        String lowered = content == null ? "" : content.toLowerCase(Locale.ROOT);
        if (!KeywordVocabulary.matchPremiumOnlyTerms(lowered).isEmpty()) {
            return TierAssignment.PREMIUM;
        }
        if (confidence >= config.freeTierThreshold()) {
            return TierAssignment.BOTH;
        }
        if (confidence >= config.premiumTierThreshold()) {
            return TierAssignment.PREMIUM;
        }
        return TierAssignment.NONE;
    }

    public ReleaseDecision shouldReleaseToFree(Signal signal, Instant now) {
        if (weeklyFreeSends(now) >= config.weeklyFreeCap()) {
            return ReleaseDecision.withhold(ReleaseDecision.WEEKLY_LIMIT);
        }
        if (!signal.tierAssignment().includes(Tier.FREE)) {
            return ReleaseDecision.withhold(ReleaseDecision.PREMIUM_ONLY);
        }
        Duration delay = Duration.ofHours(config.freeDelayHours());
        Duration elapsed = Duration.between(signal.detectedAt(), now);
        if (elapsed.compareTo(delay) < 0) {
            double remainingHours = delay.minus(elapsed).toMinutes() / 60.0;
            return ReleaseDecision.delayed(remainingHours);
        }
        return ReleaseDecision.send();
    }

    public int weeklyFreeSends(Instant now) {
        return repository.countFreeSendsBetween(now.minus(WEEKLY_WINDOW), now);
    }

    public int weeklyFreeCap() {
        return config.weeklyFreeCap();
    }
}
