package com.signalgate.service.runtime;

import com.signalgate.collectors.api.FeedPollResult;
import com.signalgate.collectors.api.FeedSource;
import com.signalgate.collectors.config.FeedSourceConfig;
import com.signalgate.collectors.config.FeedsConfig;
import com.signalgate.core.bus.EventBus;
import com.signalgate.core.events.AlertRaised;
import com.signalgate.core.events.FeedPolled;
import com.signalgate.core.events.SchedulerTickCompleted;
import com.signalgate.core.events.SchedulerTickStarted;
import com.signalgate.lifecycle.dispatch.DispatchCoordinator;
import com.signalgate.lifecycle.dispatch.ScanReport;
import com.signalgate.lifecycle.ingest.ArticleIngestor;
import com.signalgate.lifecycle.ingest.IngestReport;
import com.signalgate.lifecycle.store.StoreUnavailableException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The main worker. Every tick polls the feeds, ingests what they returned, scans for delayed free releases and
 * premium retries, and finally runs due calendar jobs, all on one thread.
 *
 * <p>A {@link StoreUnavailableException} abandons the rest of the tick and raises an alert; the next tick starts
 * from scratch. Feed failures only affect their own feed.
 */
public class SignalScheduler {
    private static final Logger LOGGER = Logger.getLogger(SignalScheduler.class.getName());

    private final FeedsConfig feeds;
    private final FeedSource feedSource;
    private final ArticleIngestor ingestor;
    private final DispatchCoordinator dispatchCoordinator;
    private final CalendarJobRunner calendarJobRunner;
    private final EventBus eventBus;
    private final Clock clock;
    private final AtomicLong ticks = new AtomicLong();
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "signal-scheduler");
        thread.setDaemon(true);
        return thread;
    });

    public SignalScheduler(
            FeedsConfig feeds,
            FeedSource feedSource,
            ArticleIngestor ingestor,
            DispatchCoordinator dispatchCoordinator,
            CalendarJobRunner calendarJobRunner,
            EventBus eventBus,
            Clock clock
    ) {
        this.feeds = feeds;
        this.feedSource = feedSource;
        this.ingestor = ingestor;
        this.dispatchCoordinator = dispatchCoordinator;
        this.calendarJobRunner = calendarJobRunner;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public void start() {
        long intervalMillis = Math.max(1000, feeds.interval().toMillis());
        timerExecutor.scheduleWithFixedDelay(this::runTickSafely, 0, intervalMillis, TimeUnit.MILLISECONDS);
        LOGGER.info("Scheduler started with interval " + feeds.interval() + " over "
                + feeds.enabledSources().size() + " feeds");
    }

    public void shutdown() {
        timerExecutor.shutdown();
        try {
            if (!timerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                timerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            timerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public TickReport runTick() {
        long tickNumber = ticks.incrementAndGet();
        Instant startedAt = clock.instant();
        eventBus.publish(new SchedulerTickStarted(startedAt, tickNumber));

        IngestReport ingest = IngestReport.empty();
        List<String> failedFeeds = new ArrayList<>();
        ScanReport releases = ScanReport.empty();
        ScanReport retries = ScanReport.empty();
        List<String> jobs = List.of();
        boolean success = true;
        try {
            for (FeedPollResult result : pollFeeds()) {
                if (!result.success()) {
                    failedFeeds.add(result.source());
                    eventBus.publish(new FeedPolled(clock.instant(), result.source(), false, 0, 0));
                    continue;
                }
                IngestReport report = ingestor.ingest(result.items(), clock.instant());
                ingest = ingest.plus(report);
                eventBus.publish(new FeedPolled(clock.instant(), result.source(), true,
                        result.items().size(), report.created()));
            }
            releases = dispatchCoordinator.releaseEligible(clock.instant());
            retries = dispatchCoordinator.retryPremium(clock.instant());
            jobs = calendarJobRunner.runDue(clock.instant());
        } catch (StoreUnavailableException e) {
            success = false;
            LOGGER.log(Level.WARNING, "Tick " + tickNumber + " aborted: store unavailable", e);
            eventBus.publish(new AlertRaised(
                    clock.instant(),
                    "store",
                    "Tick aborted, store unavailable: " + e.getMessage(),
                    Map.of("tick", tickNumber)
            ));
        }

        long durationMillis = Duration.between(startedAt, clock.instant()).toMillis();
        eventBus.publish(new SchedulerTickCompleted(clock.instant(), tickNumber, success,
                ingest.created(), releases.sent(), durationMillis));
        LOGGER.info("Tick " + tickNumber + (success ? " completed" : " aborted") + ": " + ingest.created()
                + " signals created, " + releases.sent() + " free releases, " + retries.sent()
                + " premium retries, " + failedFeeds.size() + " failed feeds");
        return new TickReport(tickNumber, success, ingest, failedFeeds, releases, retries, jobs);
    }

    public long tickCount() {
        return ticks.get();
    }

    private List<FeedPollResult> pollFeeds() {
        List<FeedSourceConfig> sources = feeds.enabledSources();
        List<CompletableFuture<FeedPollResult>> pending = new ArrayList<>();
        for (FeedSourceConfig source : sources) {
            pending.add(pollSafely(source));
        }
        List<FeedPollResult> results = new ArrayList<>();
        for (int i = 0; i < pending.size(); i++) {
            FeedSourceConfig source = sources.get(i);
            try {
                results.add(pending.get(i).join());
            } catch (RuntimeException e) {
                results.add(feedFailure(source, e));
            }
        }
        return results;
    }

    private CompletableFuture<FeedPollResult> pollSafely(FeedSourceConfig source) {
        try {
            return feedSource.poll(source);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(feedFailure(source, e));
        }
    }

    private FeedPollResult feedFailure(FeedSourceConfig source, RuntimeException error) {
        String message = "Feed poll failed: " + source.name() + " - " + error.getMessage();
        LOGGER.log(Level.WARNING, message, error);
        eventBus.publish(new AlertRaised(clock.instant(), "feed", message, Map.of("source", source.name())));
        return FeedPollResult.failure(source.name(), message);
    }

    private void runTickSafely() {
        try {
            runTick();
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Scheduler tick failed unexpectedly", e);
        }
    }
}
