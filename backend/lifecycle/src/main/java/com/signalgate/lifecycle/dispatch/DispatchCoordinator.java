package com.signalgate.lifecycle.dispatch;

import com.signalgate.core.bus.EventBus;
import com.signalgate.core.events.DispatchFailed;
import com.signalgate.core.events.SignalDispatched;
import com.signalgate.core.model.Signal;
import com.signalgate.core.model.Tier;
import com.signalgate.lifecycle.config.SignalPolicyConfig;
import com.signalgate.lifecycle.policy.ReleaseDecision;
import com.signalgate.lifecycle.policy.TierPolicy;
import com.signalgate.lifecycle.store.SignalRepository;
import com.signalgate.lifecycle.store.StoreUnavailableException;
import com.signalgate.lifecycle.store.UpdateResult;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Renders and transmits approved signals, recording each successful delivery exactly once per
 * (signal, tier) pair.
 *
 * <p>A send first claims its (signal, tier) key, then re-reads the signal, transmits, and finally flips the
 * sent flag with a compare-and-update. Only one worker can hold a claim, and the flag is only ever flipped
 * from false, so concurrent triggers never produce two deliveries. Free releases additionally run under a
 * single lock so the weekly cap is checked and consumed without interleaving.
 */
public class DispatchCoordinator {
    private static final Logger LOGGER = Logger.getLogger(DispatchCoordinator.class.getName());

    private final SignalRepository repository;
    private final TierPolicy tierPolicy;
    private final MessageRenderer renderer;
    private final Transport transport;
    private final Destinations destinations;
    private final EventBus eventBus;
    private final SignalPolicyConfig config;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final ReentrantLock freeReleaseLock = new ReentrantLock();

    public DispatchCoordinator(
            SignalRepository repository,
            TierPolicy tierPolicy,
            MessageRenderer renderer,
            Transport transport,
            Destinations destinations,
            EventBus eventBus,
            SignalPolicyConfig config
    ) {
        this.repository = repository;
        this.tierPolicy = tierPolicy;
        this.renderer = renderer;
        this.transport = transport;
        this.destinations = destinations;
        this.eventBus = eventBus;
        this.config = config;
    }

    /**
     * Dispatches a freshly approved signal: premium immediately, free through the release gate.
     */
    public DispatchSummary dispatchApproved(Signal signal, Instant now) {
        DeliveryOutcome premium = signal.tierAssignment().includes(Tier.PREMIUM)
                ? transmit(signal.id(), Tier.PREMIUM, now)
                : DeliveryOutcome.NOT_ELIGIBLE;
        if (!signal.tierAssignment().includes(Tier.FREE)) {
            return new DispatchSummary(premium, DeliveryOutcome.NOT_ELIGIBLE, null);
        }
        ReleaseAttempt free = releaseToFree(signal.id(), now);
        return new DispatchSummary(premium, free.outcome(), free.decision());
    }

    public DeliveryOutcome sendToTier(Signal signal, Tier tier, Instant now) {
        if (tier == Tier.FREE) {
            return releaseToFree(signal.id(), now).outcome();
        }
        return transmit(signal.id(), tier, now);
    }

    public ReleaseAttempt releaseToFree(String signalId, Instant now) {
        freeReleaseLock.lock();
        try {
            Optional<Signal> current = repository.findById(signalId);
            if (current.isEmpty() || !current.get().approvalStatus().dispatchable()) {
                return new ReleaseAttempt(DeliveryOutcome.NOT_ELIGIBLE, null);
            }
            Signal signal = current.get();
            if (signal.sentFree()) {
                return new ReleaseAttempt(DeliveryOutcome.ALREADY_SENT, null);
            }
            ReleaseDecision decision = tierPolicy.shouldReleaseToFree(signal, now);
            if (!decision.release()) {
                LOGGER.fine(() -> "Free release withheld for " + signalId + ": " + decision.describe());
                return new ReleaseAttempt(DeliveryOutcome.WITHHELD, decision);
            }
            return new ReleaseAttempt(transmit(signalId, Tier.FREE, now), decision);
        } finally {
            freeReleaseLock.unlock();
        }
    }

    /**
     * Delayed-release scan: every approved, free-routed, unsent signal still inside the retention window is
     * re-evaluated against the release gate.
     */
    public ScanReport releaseEligible(Instant now) {
        Instant oldest = now.minus(config.releaseRetention());
        List<Signal> candidates = repository.findFreeReleaseCandidates().stream()
                .filter(signal -> !signal.detectedAt().isBefore(oldest))
                .toList();
        int sent = 0;
        int withheld = 0;
        int failed = 0;
        for (Signal candidate : candidates) {
            try {
                DeliveryOutcome outcome = releaseToFree(candidate.id(), now).outcome();
                if (outcome == DeliveryOutcome.SENT) {
                    sent++;
                } else if (outcome == DeliveryOutcome.WITHHELD) {
                    withheld++;
                } else if (outcome == DeliveryOutcome.FAILED || outcome == DeliveryOutcome.SKIPPED_UNCONFIGURED) {
                    failed++;
                }
            } catch (StoreUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                failed++;
                LOGGER.log(Level.WARNING, "Free release failed for signal " + candidate.id(), e);
            }
        }
        return new ScanReport(candidates.size(), sent, withheld, failed);
    }

    /**
     * Bounded premium retry: approved premium-routed signals whose premium delivery has not succeeded are
     * retried while they are younger than the retry window and below the attempt limit.
     */
    public ScanReport retryPremium(Instant now) {
        Instant oldest = now.minus(config.premiumRetryWindow());
        List<Signal> candidates = repository.findPremiumRetryCandidates().stream()
                .filter(signal -> signal.premiumAttempts() < config.maxPremiumAttempts())
                .filter(signal -> !signal.detectedAt().isBefore(oldest))
                .toList();
        int sent = 0;
        int failed = 0;
        for (Signal candidate : candidates) {
            try {
                DeliveryOutcome outcome = transmit(candidate.id(), Tier.PREMIUM, now);
                if (outcome == DeliveryOutcome.SENT) {
                    sent++;
                } else if (outcome == DeliveryOutcome.FAILED) {
                    failed++;
                }
            } catch (StoreUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                failed++;
                LOGGER.log(Level.WARNING, "Premium retry failed for signal " + candidate.id(), e);
            }
        }
        return new ScanReport(candidates.size(), sent, 0, failed);
    }

    public SignalPreview preview(Signal signal, Instant now) {
        ReleaseDecision decision = signal.sentFree() ? null : tierPolicy.shouldReleaseToFree(signal, now);
        return new SignalPreview(signal, renderer.renderPremium(signal), renderer.renderFree(signal), decision);
    }

    private DeliveryOutcome transmit(String signalId, Tier tier, Instant now) {
        String claim = signalId + ":" + tier;
        if (!inFlight.add(claim)) {
            return DeliveryOutcome.IN_FLIGHT;
        }
        try {
            Optional<Signal> current = repository.findById(signalId);
            if (current.isEmpty()
                    || !current.get().approvalStatus().dispatchable()
                    || !current.get().tierAssignment().includes(tier)) {
                return DeliveryOutcome.NOT_ELIGIBLE;
            }
            Signal signal = current.get();
            if (signal.sent(tier)) {
                return DeliveryOutcome.ALREADY_SENT;
            }
            Optional<String> destination = destinations.forTier(tier);
            if (destination.isEmpty()) {
                LOGGER.warning("No " + tier + " destination configured; signal " + signalId + " not sent");
                return DeliveryOutcome.SKIPPED_UNCONFIGURED;
            }

            String message = tier == Tier.PREMIUM ? renderer.renderPremium(signal) : renderer.renderFree(signal);
            TransportResult result;
            try {
                result = transport.send(destination.get(), message);
            } catch (RuntimeException e) {
                result = TransportResult.failure(rootMessage(e));
            }
            if (!result.success()) {
                recordFailure(signalId, tier, result.detail(), now);
                return DeliveryOutcome.FAILED;
            }

            UpdateResult update = repository.compareAndUpdate(
                    signalId,
                    stored -> stored.approvalStatus().dispatchable() && !stored.sent(tier),
                    stored -> stored.markSent(tier, now)
            );
            if (!update.applied()) {
                LOGGER.warning("Signal " + signalId + " was already marked sent to " + tier + " after transmission");
                return DeliveryOutcome.ALREADY_SENT;
            }
            eventBus.publish(new SignalDispatched(now, signalId, tier, destination.get()));
            LOGGER.info("Dispatched signal " + signalId + " to " + tier);
            return DeliveryOutcome.SENT;
        } finally {
            inFlight.remove(claim);
        }
    }

    private void recordFailure(String signalId, Tier tier, String detail, Instant now) {
        LOGGER.warning("Transport failed for signal " + signalId + " (" + tier + "): " + detail);
        if (tier == Tier.PREMIUM) {
            repository.compareAndUpdate(signalId, stored -> !stored.sentPremium(), Signal::withPremiumAttempt);
        }
        eventBus.publish(new DispatchFailed(now, signalId, tier, detail));
    }

    private static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }

    public record ReleaseAttempt(DeliveryOutcome outcome, ReleaseDecision decision) {
    }
}
