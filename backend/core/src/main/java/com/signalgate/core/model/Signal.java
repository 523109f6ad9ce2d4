package com.signalgate.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A scored, classified candidate alert derived from one article.
 *
 * <p>Instances are immutable; lifecycle changes produce a new copy through the {@code with*}/{@code mark*}
 * methods. Stores are responsible for applying those copies atomically against the precondition they checked.
 */
public record Signal(
        String id,
        SignalType signalType,
        String source,
        String title,
        String link,
        String content,
        double confidence,
        Instant detectedAt,
        String prediction,
        List<String> evidence,
        ApprovalStatus approvalStatus,
        TierAssignment tierAssignment,
        boolean sentFree,
        Instant sentFreeAt,
        boolean sentPremium,
        Instant sentPremiumAt,
        Instant approvedAt,
        String rejectionReason,
        int premiumAttempts
) {
    public Signal {
        Objects.requireNonNull(signalType, "signalType is required");
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(detectedAt, "detectedAt is required");
        Objects.requireNonNull(approvalStatus, "approvalStatus is required");
        Objects.requireNonNull(tierAssignment, "tierAssignment is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    /**
     * Builds an unsaved signal as produced by classification: no id yet, pending, not routed to any tier.
     */
    public static Signal draft(
            SignalType signalType,
            String source,
            String title,
            String link,
            String content,
            double confidence,
            Instant detectedAt,
            String prediction,
            List<String> evidence
    ) {
        return new Signal(
                null,
                signalType,
                source,
                title,
                link,
                content,
                confidence,
                detectedAt,
                prediction,
                evidence,
                ApprovalStatus.PENDING,
                TierAssignment.NONE,
                false,
                null,
                false,
                null,
                null,
                null,
                0
        );
    }

    public Signal withId(String newId) {
        return new Signal(newId, signalType, source, title, link, content, confidence, detectedAt, prediction,
                evidence, approvalStatus, tierAssignment, sentFree, sentFreeAt, sentPremium, sentPremiumAt,
                approvedAt, rejectionReason, premiumAttempts);
    }

    public Signal withTier(TierAssignment tier) {
        return new Signal(id, signalType, source, title, link, content, confidence, detectedAt, prediction,
                evidence, approvalStatus, tier, sentFree, sentFreeAt, sentPremium, sentPremiumAt,
                approvedAt, rejectionReason, premiumAttempts);
    }

    public Signal decide(ApprovalStatus status, Instant decidedAt) {
        if (approvalStatus.decided()) {
            throw new IllegalStateException("Signal " + id + " already " + approvalStatus);
        }
        return new Signal(id, signalType, source, title, link, content, confidence, detectedAt, prediction,
                evidence, status, tierAssignment, sentFree, sentFreeAt, sentPremium, sentPremiumAt,
                decidedAt, rejectionReason, premiumAttempts);
    }

    public Signal reject(String reason, Instant decidedAt) {
        return decide(ApprovalStatus.REJECTED, decidedAt).withRejectionReason(reason);
    }

    public Signal markSent(Tier tier, Instant at) {
        if (!approvalStatus.dispatchable()) {
            throw new IllegalStateException("Signal " + id + " is " + approvalStatus + " and cannot be sent");
        }
        return switch (tier) {
            case FREE -> new Signal(id, signalType, source, title, link, content, confidence, detectedAt,
                    prediction, evidence, approvalStatus, tierAssignment, true, at, sentPremium, sentPremiumAt,
                    approvedAt, rejectionReason, premiumAttempts);
            case PREMIUM -> new Signal(id, signalType, source, title, link, content, confidence, detectedAt,
                    prediction, evidence, approvalStatus, tierAssignment, sentFree, sentFreeAt, true, at,
                    approvedAt, rejectionReason, premiumAttempts);
        };
    }

    public Signal withPremiumAttempt() {
        return new Signal(id, signalType, source, title, link, content, confidence, detectedAt, prediction,
                evidence, approvalStatus, tierAssignment, sentFree, sentFreeAt, sentPremium, sentPremiumAt,
                approvedAt, rejectionReason, premiumAttempts + 1);
    }

    public boolean sent(Tier tier) {
        return tier == Tier.FREE ? sentFree : sentPremium;
    }

    private Signal withRejectionReason(String reason) {
        return new Signal(id, signalType, source, title, link, content, confidence, detectedAt, prediction,
                evidence, approvalStatus, tierAssignment, sentFree, sentFreeAt, sentPremium, sentPremiumAt,
                approvedAt, reason, premiumAttempts);
    }
}
