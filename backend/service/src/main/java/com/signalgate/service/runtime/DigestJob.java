package com.signalgate.service.runtime;

import com.signalgate.core.model.Signal;
import com.signalgate.core.model.Tier;
import com.signalgate.lifecycle.dispatch.MessageRenderer;
import com.signalgate.lifecycle.store.SignalRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Periodic summary of the top approved signals. Digests never touch per-signal sent flags and do not count
 * against the weekly free cap.
 */
public class DigestJob implements CalendarJob {
    private final String name;
    private final DigestKind kind;
    private final CalendarSchedule schedule;
    private final Tier tier;
    private final SignalRepository repository;
    private final MessageRenderer renderer;
    private final ContentProvider contentProvider;
    private final int digestSize;

    public DigestJob(
            String name,
            DigestKind kind,
            CalendarSchedule schedule,
            Tier tier,
            SignalRepository repository,
            MessageRenderer renderer,
            ContentProvider contentProvider,
            int digestSize
    ) {
        if (kind.monthly() != schedule.isMonthly()) {
            throw new IllegalArgumentException("Job " + name + ": " + kind + " needs a "
                    + (kind.monthly() ? "monthly" : "weekly") + " schedule");
        }
        this.name = name;
        this.kind = kind;
        this.schedule = schedule;
        this.tier = tier;
        this.repository = repository;
        this.renderer = renderer;
        this.contentProvider = contentProvider;
        this.digestSize = digestSize;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CalendarSchedule schedule() {
        return schedule;
    }

    @Override
    public Tier tier() {
        return tier;
    }

    public DigestKind kind() {
        return kind;
    }

    @Override
    public String compose(Instant now) {
        List<Signal> top = topSignals(now);
        String heading = kind.heading() + " (" + schedule.periodKey(now) + ")";
        return renderer.renderDigest(heading, top, contentProvider.narrative(kind, top, now));
    }

    List<Signal> topSignals(Instant now) {
        Instant from = kind.monthly() ? schedule.periodStart(now).toInstant() : now.minus(kind.lookback());
        return repository.findDetectedBetween(from, now).stream()
                .filter(signal -> signal.approvalStatus().dispatchable())
                .sorted(Comparator.comparingDouble(Signal::confidence).reversed()
                        .thenComparing(Signal::detectedAt))
                .limit(digestSize)
                .toList();
    }
}
