package com.signalgate.lifecycle.approval;

import com.signalgate.core.bus.EventBus;
import com.signalgate.core.events.SignalCreated;
import com.signalgate.core.events.SignalDecided;
import com.signalgate.core.model.ApprovalStatus;
import com.signalgate.core.model.Signal;
import com.signalgate.core.model.SignalType;
import com.signalgate.core.model.TierAssignment;
import com.signalgate.lifecycle.config.SignalPolicyConfig;
import com.signalgate.lifecycle.dispatch.DispatchCoordinator;
import com.signalgate.lifecycle.dispatch.DispatchSummary;
import com.signalgate.lifecycle.dispatch.SignalPreview;
import com.signalgate.lifecycle.policy.TierPolicy;
import com.signalgate.lifecycle.store.SignalRepository;
import com.signalgate.lifecycle.store.UpdateResult;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Owns the approval lifecycle of every signal.
 *
 * <pre>
 *   PENDING --auto (confidence &gt;= autoApproveThreshold)--&gt; AUTO_APPROVED
 *   PENDING --approve / approveOverride------------------&gt; APPROVED
 *   PENDING --reject-------------------------------------&gt; REJECTED
 * </pre>
 *
 * Every transition is a single compare-and-update against {@code PENDING}, so a racing approve and reject on
 * the same id resolve to exactly one winner; the loser receives {@link CommandError#ALREADY_PROCESSED}.
 * Dispatch only follows a transition this instance actually applied.
 */
public class ApprovalStateMachine {
    private static final Logger LOGGER = Logger.getLogger(ApprovalStateMachine.class.getName());

    private final SignalRepository repository;
    private final TierPolicy tierPolicy;
    private final DispatchCoordinator dispatchCoordinator;
    private final SignalPolicyConfig config;
    private final EventBus eventBus;
    private final Clock clock;

    public ApprovalStateMachine(
            SignalRepository repository,
            TierPolicy tierPolicy,
            DispatchCoordinator dispatchCoordinator,
            SignalPolicyConfig config,
            EventBus eventBus,
            Clock clock
    ) {
        this.repository = repository;
        this.tierPolicy = tierPolicy;
        this.dispatchCoordinator = dispatchCoordinator;
        this.config = config;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /**
     * Persists a classified draft as a pending signal and routes it. High-confidence signals are
     * auto-approved and dispatched before this method returns.
     */
    public CommandResult create(Signal draft) {
        TierAssignment tier = tierPolicy.assignTier(draft);
        Signal stored = insertWithUniqueId(draft.withTier(tier));
        Instant now = clock.instant();
        eventBus.publish(new SignalCreated(now, stored.id(), stored.signalType(), stored.source(),
                stored.confidence(), stored.tierAssignment()));
        LOGGER.info("Created signal " + stored.id() + " [" + stored.signalType() + ", confidence "
                + stored.confidence() + ", tier " + stored.tierAssignment() + "]");

        if (stored.confidence() < config.autoApproveThreshold()) {
            return CommandResult.ok("Signal " + stored.id() + " queued for review", stored, DispatchSummary.none());
        }
        return transition(
                stored.id(),
                signal -> signal.decide(ApprovalStatus.AUTO_APPROVED, now),
                "auto-approved at confidence " + stored.confidence(),
                now
        );
    }

    public CommandResult approve(String id) {
        Instant now = clock.instant();
        return transition(id, signal -> signal.decide(ApprovalStatus.APPROVED, now), "approved", now);
    }

    public CommandResult approveOverride(String id, TierAssignment tier) {
        if (tier == null || tier == TierAssignment.NONE) {
            return CommandResult.failure(CommandError.INVALID_ARGUMENT,
                    "Tier override must be one of premium, free, both", null);
        }
        Instant now = clock.instant();
        return transition(
                id,
                signal -> signal.withTier(tier).decide(ApprovalStatus.APPROVED, now),
                "approved with tier override " + tier,
                now
        );
    }

    public CommandResult reject(String id, String reason) {
        Instant now = clock.instant();
        String annotation = reason == null || reason.isBlank() ? "rejected by operator" : reason.trim();
        return transition(id, signal -> signal.reject(annotation, now), "rejected: " + annotation, now);
    }

    public Optional<SignalPreview> preview(String id) {
        return repository.findById(id).map(signal -> dispatchCoordinator.preview(signal, clock.instant()));
    }

    public List<Signal> listPending() {
        return repository.findByStatus(ApprovalStatus.PENDING);
    }

    public SignalStats stats() {
        List<Signal> all = repository.findAll();
        Map<ApprovalStatus, Long> byStatus = new EnumMap<>(ApprovalStatus.class);
        Map<SignalType, Long> byType = new EnumMap<>(SignalType.class);
        Map<TierAssignment, Long> byTier = new EnumMap<>(TierAssignment.class);
        long sentPremium = 0;
        long sentFree = 0;
        double confidenceSum = 0.0;
        for (Signal signal : all) {
            byStatus.merge(signal.approvalStatus(), 1L, Long::sum);
            byType.merge(signal.signalType(), 1L, Long::sum);
            byTier.merge(signal.tierAssignment(), 1L, Long::sum);
            sentPremium += signal.sentPremium() ? 1 : 0;
            sentFree += signal.sentFree() ? 1 : 0;
            confidenceSum += signal.confidence();
        }
        double average = all.isEmpty() ? 0.0 : Math.round(confidenceSum / all.size() * 100.0) / 100.0;
        return new SignalStats(
                all.size(),
                byStatus,
                byType,
                byTier,
                sentPremium,
                sentFree,
                tierPolicy.weeklyFreeSends(clock.instant()),
                tierPolicy.weeklyFreeCap(),
                average
        );
    }

    private CommandResult transition(String id, UnaryOperator<Signal> change, String note, Instant now) {
        UpdateResult update = repository.compareAndUpdate(
                id,
                signal -> signal.approvalStatus() == ApprovalStatus.PENDING,
                change
        );
        switch (update.status()) {
            case NOT_FOUND:
                return CommandResult.failure(CommandError.NOT_FOUND, "No pending signal with id " + id, null);
            case PRECONDITION_FAILED:
                return CommandResult.failure(
                        CommandError.ALREADY_PROCESSED,
                        "Signal " + id + " was already processed (" + update.signal().approvalStatus() + ")",
                        update.signal()
                );
            default:
                break;
        }

        Signal decided = update.signal();
        eventBus.publish(new SignalDecided(now, decided.id(), decided.approvalStatus(), decided.tierAssignment(), note));
        LOGGER.info("Signal " + decided.id() + " " + note);
        if (!decided.approvalStatus().dispatchable()) {
            return CommandResult.ok("Signal " + decided.id() + " " + note, decided, DispatchSummary.none());
        }
        DispatchSummary summary = dispatchCoordinator.dispatchApproved(decided, now);
        Signal latest = repository.findById(decided.id()).orElse(decided);
        return CommandResult.ok("Signal " + decided.id() + " " + note, latest, summary);
    }

    private Signal insertWithUniqueId(Signal signal) {
        for (int attempt = 0; attempt < SignalIdGenerator.MAX_ATTEMPTS; attempt++) {
            Signal candidate = signal.withId(SignalIdGenerator.candidate(signal, attempt));
            if (repository.insertIfAbsent(candidate)) {
                return candidate;
            }
            LOGGER.warning("Signal id collision on " + candidate.id() + ", re-deriving");
        }
        throw new IllegalStateException("Unable to allocate a unique signal id after "
                + SignalIdGenerator.MAX_ATTEMPTS + " attempts");
    }
}
