package com.signalgate.service.runtime;

import com.signalgate.core.events.CalendarJobCompleted;
import com.signalgate.core.model.Signal;
import com.signalgate.core.model.SignalType;
import com.signalgate.core.model.Tier;
import com.signalgate.core.model.TierAssignment;
import com.signalgate.lifecycle.dispatch.Destinations;
import com.signalgate.service.store.JobRunLedger;
import com.signalgate.service.support.RecordingTransport;
import com.signalgate.service.support.ServiceHarness;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CalendarJobRunnerTest {
    private static final CalendarSchedule MONDAY_NINE =
            CalendarSchedule.weekly(DayOfWeek.MONDAY, LocalTime.of(9, 0), ZoneOffset.UTC);

    @Test
    void weeklyDigestSendsTopApprovedSignalsOncePerPeriod() throws Exception {
        ServiceHarness harness = new ServiceHarness();
        Instant now = ServiceHarness.START;
        harness.repository.insertIfAbsent(ServiceHarness.approvedSignal("low", SignalType.FUNDING, 0.72, now.minus(Duration.ofDays(1))));
        harness.repository.insertIfAbsent(ServiceHarness.approvedSignal("high", SignalType.IPO, 0.96, now.minus(Duration.ofDays(2))));
        harness.repository.insertIfAbsent(ServiceHarness.approvedSignal("old", SignalType.IPO, 0.99, now.minus(Duration.ofDays(9))));
        harness.repository.insertIfAbsent(ServiceHarness.signal("pending", SignalType.IPO, 0.98, TierAssignment.BOTH, now.minus(Duration.ofHours(3))));
        CalendarJobRunner runner = runner(harness, harness.transport, harness.destinations, 5);

        List<String> first = runner.runDue(now);
        List<String> second = runner.runDue(now.plus(Duration.ofHours(1)));

        assertEquals(List.of("weekly-digest"), first);
        assertEquals(List.of(), second);
        List<RecordingTransport.Sent> sent = harness.transport.sentTo(ServiceHarness.FREE);
        assertEquals(1, sent.size());
        String digest = sent.get(0).message();
        assertTrue(digest.startsWith("Weekly Digest (2026-W42)"));
        assertTrue(digest.indexOf("Headline high") < digest.indexOf("Headline low"));
        assertFalse(digest.contains("Headline old"));
        assertFalse(digest.contains("Headline pending"));
        assertTrue(digest.contains("Most active category:"));
    }

    @Test
    void digestsLeaveSentFlagsAndTheWeeklyCapAlone() throws Exception {
        ServiceHarness harness = new ServiceHarness();
        Instant now = ServiceHarness.START;
        harness.repository.insertIfAbsent(ServiceHarness.approvedSignal("s1", SignalType.FUNDING, 0.9, now.minus(Duration.ofDays(1))));

        runner(harness, harness.transport, harness.destinations, 5).runDue(now);

        Signal stored = harness.repository.findById("s1").orElseThrow();
        assertFalse(stored.sent(Tier.FREE));
        assertEquals(0, harness.tierPolicy.weeklyFreeSends(now));
    }

    @Test
    void failedSendIsRetriedOnTheNextTick() throws Exception {
        ServiceHarness harness = new ServiceHarness();
        CalendarJobRunner runner = runner(harness, harness.transport, harness.destinations, 5);
        harness.transport.setDown(true);

        assertEquals(List.of(), runner.runDue(ServiceHarness.START));
        harness.transport.setDown(false);
        assertEquals(List.of("weekly-digest"), runner.runDue(ServiceHarness.START.plusSeconds(60)));

        assertEquals(1, harness.transport.sent().size());
        assertTrue(harness.transport.sent().get(0).message().contains("No approved signals this period."));
        List<CalendarJobCompleted> completions = harness.events.stream()
                .filter(CalendarJobCompleted.class::isInstance).map(CalendarJobCompleted.class::cast).toList();
        assertEquals(List.of(false, true), completions.stream().map(CalendarJobCompleted::success).toList());
    }

    @Test
    void missingDestinationSkipsThePeriodWithoutSending() throws Exception {
        ServiceHarness harness = new ServiceHarness();
        JobRunLedger ledger = new JobRunLedger(harness.dir.resolve("state/job-runs.json"));
        CalendarJobRunner runner = new CalendarJobRunner(
                List.of(weeklyDigest(harness, 5)),
                ledger,
                harness.transport,
                new Destinations(ServiceHarness.PREMIUM, null),
                harness.bus
        );

        assertEquals(List.of(), runner.runDue(ServiceHarness.START));
        assertEquals(List.of(), runner.runDue(ServiceHarness.START.plusSeconds(60)));

        assertTrue(harness.transport.sent().isEmpty());
        assertEquals(Optional.of("2026-W42"), ledger.lastPeriod("weekly-digest"));
        assertEquals(1, harness.count("CalendarJobCompleted"));
    }

    @Test
    void monthlyKindNeedsMonthlySchedule() throws Exception {
        ServiceHarness harness = new ServiceHarness();

        assertThrows(IllegalArgumentException.class, () -> new DigestJob("monthly", DigestKind.MONTHLY_DIGEST,
                MONDAY_NINE, Tier.PREMIUM, harness.repository, harness.renderer, new RotatingContentProvider(), 5));
    }

    @Test
    void digestSizeCapsTheList() throws Exception {
        ServiceHarness harness = new ServiceHarness();
        for (int i = 0; i < 4; i++) {
            harness.repository.insertIfAbsent(ServiceHarness.approvedSignal(
                    "s" + i, SignalType.FUNDING, 0.8 + i * 0.01, ServiceHarness.START.minus(Duration.ofHours(i + 1))));
        }

        DigestJob job = weeklyDigest(harness, 2);
        List<Signal> top = job.topSignals(ServiceHarness.START);

        assertEquals(List.of("s3", "s2"), top.stream().map(Signal::id).toList());
    }

    private static CalendarJobRunner runner(
            ServiceHarness harness,
            RecordingTransport transport,
            Destinations destinations,
            int digestSize
    ) {
        return new CalendarJobRunner(
                List.of(weeklyDigest(harness, digestSize)),
                new JobRunLedger(harness.dir.resolve("state/job-runs.json")),
                transport,
                destinations,
                harness.bus
        );
    }

    private static DigestJob weeklyDigest(ServiceHarness harness, int digestSize) {
        return new DigestJob("weekly-digest", DigestKind.WEEKLY_DIGEST, MONDAY_NINE, Tier.FREE,
                harness.repository, harness.renderer, new RotatingContentProvider(), digestSize);
    }
}
