package com.signalgate.service;

import com.signalgate.collectors.config.FeedsConfig;
import com.signalgate.collectors.rss.RssFeedSource;
import com.signalgate.core.bus.EventBus;
import com.signalgate.lifecycle.approval.ApprovalStateMachine;
import com.signalgate.lifecycle.classify.Classifier;
import com.signalgate.lifecycle.config.SignalPolicyConfig;
import com.signalgate.lifecycle.dedup.Deduplicator;
import com.signalgate.lifecycle.dispatch.DispatchCoordinator;
import com.signalgate.lifecycle.dispatch.MessageRenderer;
import com.signalgate.lifecycle.dispatch.Transport;
import com.signalgate.lifecycle.ingest.ArticleIngestor;
import com.signalgate.lifecycle.policy.TierPolicy;
import com.signalgate.lifecycle.store.SignalRepository;
import com.signalgate.service.admin.AdminCommandHandler;
import com.signalgate.service.admin.AdminCommandPoller;
import com.signalgate.service.admin.AdminCursorStore;
import com.signalgate.service.admin.JsonlAdminCommandSource;
import com.signalgate.service.admin.JsonlAdminReplySink;
import com.signalgate.service.api.ApiServer;
import com.signalgate.service.config.AdminConfig;
import com.signalgate.service.config.CalendarConfig;
import com.signalgate.service.config.CalendarJobConfig;
import com.signalgate.service.config.ConfigLoader;
import com.signalgate.service.config.DispatchConfig;
import com.signalgate.service.http.HttpClientFactory;
import com.signalgate.service.render.TemplateMessageRenderer;
import com.signalgate.service.runtime.CalendarJob;
import com.signalgate.service.runtime.CalendarJobRunner;
import com.signalgate.service.runtime.CalendarSchedule;
import com.signalgate.service.runtime.ContentProvider;
import com.signalgate.service.runtime.DigestJob;
import com.signalgate.service.runtime.RotatingContentProvider;
import com.signalgate.service.runtime.SignalScheduler;
import com.signalgate.service.store.JobRunLedger;
import com.signalgate.service.store.JsonFileArticleLedger;
import com.signalgate.service.store.JsonFileSignalRepository;
import com.signalgate.service.store.JsonlEventStore;
import com.signalgate.service.transport.OutboxTransport;
import com.signalgate.service.transport.WebhookTransport;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.function.Consumer;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        Path configDir = Path.of("config");
        Path signalsFile = Path.of("state/signals.json");
        Path articlesFile = Path.of("state/articles.json");
        Path jobRunsFile = Path.of("state/job-runs.json");
        Path eventLogFile = Path.of("logs/events.jsonl");
        RuntimeFlags runtimeFlags = resolveRuntimeFlags(System.getenv(), LOGGER::warning);
        Clock clock = Clock.systemUTC();

        SignalPolicyConfig policy = ConfigLoader.loadPolicy(configDir);
        FeedsConfig feeds = ConfigLoader.loadFeeds(configDir);
        DispatchConfig dispatch = ConfigLoader.loadDispatch(configDir).resolve(System.getenv(), runtimeFlags.devMode());
        CalendarConfig calendar = ConfigLoader.loadCalendar(configDir);
        AdminConfig admin = ConfigLoader.loadAdmin(configDir);

        EventBus eventBus = new EventBus();
        JsonlEventStore eventStore = new JsonlEventStore(eventLogFile);
        eventBus.subscribeAll(eventStore::append);

        JsonFileSignalRepository repository = new JsonFileSignalRepository(signalsFile);
        JsonFileArticleLedger articleLedger = new JsonFileArticleLedger(articlesFile);
        HttpClient sharedHttpClient = HttpClientFactory.create(Duration.ofSeconds(5));

        Transport transport;
        if (dispatch.outbox()) {
            LOGGER.info("Dispatch transport is the local outbox at " + dispatch.outboxFile());
            transport = new OutboxTransport(Path.of(dispatch.outboxFile()), clock);
        } else {
            transport = new WebhookTransport(sharedHttpClient, dispatch.requestTimeout());
        }
        MessageRenderer renderer = new TemplateMessageRenderer();

        TierPolicy tierPolicy = new TierPolicy(policy, repository);
        DispatchCoordinator coordinator = new DispatchCoordinator(
                repository, tierPolicy, renderer, transport, dispatch.destinations(), eventBus, policy);
        ApprovalStateMachine stateMachine = new ApprovalStateMachine(
                repository, tierPolicy, coordinator, policy, eventBus, clock);
        ArticleIngestor ingestor = new ArticleIngestor(
                new Classifier(policy), new Deduplicator(articleLedger), stateMachine, policy);

        CalendarJobRunner calendarJobRunner = new CalendarJobRunner(
                buildCalendarJobs(calendar, repository, renderer, new RotatingContentProvider()),
                new JobRunLedger(jobRunsFile),
                transport,
                dispatch.destinations(),
                eventBus
        );
        SignalScheduler scheduler = new SignalScheduler(
                feeds,
                new RssFeedSource(sharedHttpClient, eventBus, clock, feeds.requestTimeout()),
                ingestor,
                coordinator,
                calendarJobRunner,
                eventBus,
                clock
        );
        AdminCommandPoller adminPoller = new AdminCommandPoller(
                new JsonlAdminCommandSource(Path.of(admin.inboxFile())),
                new AdminCommandHandler(stateMachine),
                new JsonlAdminReplySink(Path.of(admin.outboxFile()), clock),
                new AdminCursorStore(Path.of(admin.cursorFile())),
                admin.batchSize()
        );
        ApiServer apiServer = new ApiServer(admin.apiPort(), stateMachine, eventStore);

        LOGGER.info("Starting with " + feeds.enabledSources().size() + " feeds, "
                + calendarJobRunner.jobs().size() + " calendar jobs, "
                + (runtimeFlags.devMode() ? "dev" : "prod") + " mode");
        scheduler.start();
        adminPoller.start(admin.pollInterval());
        apiServer.start();

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.shutdown();
            adminPoller.shutdown();
            apiServer.stop();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    static List<CalendarJob> buildCalendarJobs(
            CalendarConfig calendar,
            SignalRepository repository,
            MessageRenderer renderer,
            ContentProvider contentProvider
    ) {
        List<CalendarJob> jobs = new ArrayList<>();
        for (CalendarJobConfig job : calendar.enabledJobs()) {
            CalendarSchedule schedule;
            try {
                schedule = job.kind().monthly()
                        ? CalendarSchedule.monthly(requireDay(job.dayOfMonth(), job), job.time(), calendar.zoneId())
                        : CalendarSchedule.weekly(requireWeekday(job.dayOfWeek(), job), job.time(), calendar.zoneId());
                jobs.add(new DigestJob(job.name(), job.kind(), schedule, job.tier(), repository, renderer,
                        contentProvider, calendar.digestSize()));
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Invalid calendar job " + job.name() + ": " + e.getMessage(), e);
            }
        }
        return jobs;
    }

    private static DayOfWeek requireWeekday(DayOfWeek dayOfWeek, CalendarJobConfig job) {
        if (dayOfWeek == null) {
            throw new IllegalArgumentException(job.kind() + " needs dayOfWeek");
        }
        return dayOfWeek;
    }

    private static int requireDay(Integer dayOfMonth, CalendarJobConfig job) {
        if (dayOfMonth == null) {
            throw new IllegalArgumentException(job.kind() + " needs dayOfMonth");
        }
        return dayOfMonth;
    }

    static RuntimeFlags resolveRuntimeFlags(Map<String, String> env, Consumer<String> warn) {
        String appEnvRaw = env.getOrDefault("APP_ENV", "dev");
        boolean devMode;
        if ("prod".equalsIgnoreCase(appEnvRaw)) {
            devMode = false;
        } else if ("dev".equalsIgnoreCase(appEnvRaw)) {
            devMode = true;
        } else {
            devMode = true;
            warn.accept("Unknown APP_ENV=" + appEnvRaw + ", defaulting to dev");
        }
        return new RuntimeFlags(devMode);
    }

    record RuntimeFlags(boolean devMode) {
    }
}
