package com.signalgate.service.runtime;

import com.signalgate.core.bus.EventBus;
import com.signalgate.core.events.CalendarJobCompleted;
import com.signalgate.lifecycle.dispatch.Destinations;
import com.signalgate.lifecycle.dispatch.Transport;
import com.signalgate.lifecycle.dispatch.TransportResult;
import com.signalgate.lifecycle.store.StoreUnavailableException;
import com.signalgate.service.store.JobRunLedger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs each calendar job at most once per period. A period is recorded only after the message went out, so a
 * failed send is retried on the next tick. A job whose tier has no destination is recorded as skipped for the
 * period.
 */
public class CalendarJobRunner {
    private static final Logger LOGGER = Logger.getLogger(CalendarJobRunner.class.getName());

    private final List<CalendarJob> jobs;
    private final JobRunLedger ledger;
    private final Transport transport;
    private final Destinations destinations;
    private final EventBus eventBus;

    public CalendarJobRunner(
            List<CalendarJob> jobs,
            JobRunLedger ledger,
            Transport transport,
            Destinations destinations,
            EventBus eventBus
    ) {
        this.jobs = List.copyOf(jobs);
        this.ledger = ledger;
        this.transport = transport;
        this.destinations = destinations;
        this.eventBus = eventBus;
    }

    public List<String> runDue(Instant now) {
        List<String> completed = new ArrayList<>();
        for (CalendarJob job : jobs) {
            if (!job.schedule().isDue(now, ledger.lastPeriod(job.name()))) {
                continue;
            }
            if (runJob(job, now)) {
                completed.add(job.name());
            }
        }
        return completed;
    }

    public List<CalendarJob> jobs() {
        return jobs;
    }

    private boolean runJob(CalendarJob job, Instant now) {
        String period = job.schedule().periodKey(now);
        Optional<String> destination = destinations.forTier(job.tier());
        if (destination.isEmpty()) {
            LOGGER.warning("No " + job.tier() + " destination configured; calendar job " + job.name()
                    + " skipped for " + period);
            ledger.record(job.name(), period);
            eventBus.publish(new CalendarJobCompleted(now, job.name(), period, false));
            return false;
        }

        String message;
        try {
            message = job.compose(now);
        } catch (StoreUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Calendar job " + job.name() + " failed to build its message", e);
            eventBus.publish(new CalendarJobCompleted(now, job.name(), period, false));
            return false;
        }

        TransportResult result;
        try {
            result = transport.send(destination.get(), message);
        } catch (RuntimeException e) {
            result = TransportResult.failure(e.getMessage());
        }
        if (!result.success()) {
            LOGGER.warning("Calendar job " + job.name() + " send failed for " + period + ": " + result.detail());
            eventBus.publish(new CalendarJobCompleted(now, job.name(), period, false));
            return false;
        }
        ledger.record(job.name(), period);
        eventBus.publish(new CalendarJobCompleted(now, job.name(), period, true));
        LOGGER.info("Calendar job " + job.name() + " sent for " + period);
        return true;
    }
}
