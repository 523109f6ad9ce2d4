package com.signalgate.lifecycle.store;

import com.signalgate.core.model.ApprovalStatus;
import com.signalgate.core.model.Signal;
import com.signalgate.core.model.Tier;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Persistence port for signals.
 *
 * <p>{@link #compareAndUpdate} is the only way to change a stored signal. Implementations must evaluate the
 * precondition and apply the change as one indivisible step with respect to every other call on the same
 * repository, so two workers racing on the same id cannot both succeed.
 */
public interface SignalRepository {
    boolean insertIfAbsent(Signal signal);

    Optional<Signal> findById(String id);

    UpdateResult compareAndUpdate(String id, Predicate<Signal> precondition, UnaryOperator<Signal> change);

    List<Signal> findAll();

    default List<Signal> findByStatus(ApprovalStatus status) {
        return findAll().stream()
                .filter(signal -> signal.approvalStatus() == status)
                .sorted(Comparator.comparing(Signal::detectedAt))
                .toList();
    }

    /**
     * Approved signals routed to the free tier that have not been sent there yet.
     */
    default List<Signal> findFreeReleaseCandidates() {
        return findAll().stream()
                .filter(signal -> signal.approvalStatus().dispatchable())
                .filter(signal -> signal.tierAssignment().includes(Tier.FREE))
                .filter(signal -> !signal.sentFree())
                .sorted(Comparator.comparing(Signal::detectedAt))
                .toList();
    }

    default List<Signal> findPremiumRetryCandidates() {
        return findAll().stream()
                .filter(signal -> signal.approvalStatus().dispatchable())
                .filter(signal -> signal.tierAssignment().includes(Tier.PREMIUM))
                .filter(signal -> !signal.sentPremium())
                .sorted(Comparator.comparing(Signal::detectedAt))
                .toList();
    }

    /**
     * Number of free-tier sends whose dispatch time lies in {@code [from, to]}.
     */
    default int countFreeSendsBetween(Instant from, Instant to) {
        return (int) findAll().stream()
                .filter(Signal::sentFree)
                .map(Signal::sentFreeAt)
                .filter(at -> at != null && !at.isBefore(from) && !at.isAfter(to))
                .count();
    }

    default List<Signal> findDetectedBetween(Instant from, Instant to) {
        return findAll().stream()
                .filter(signal -> !signal.detectedAt().isBefore(from) && signal.detectedAt().isBefore(to))
                .sorted(Comparator.comparing(Signal::detectedAt))
                .toList();
    }
}
