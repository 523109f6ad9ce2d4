package com.signalgate.service.admin;

import com.signalgate.lifecycle.store.StoreUnavailableException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Second worker: reads admin commands after the persisted cursor, handles them in order and replies.
 *
 * <p>The cursor is saved right after a command is handled and before the reply goes out, so a restart never
 * replays a handled command. A store outage stops the batch without advancing past the failing command.
 */
public class AdminCommandPoller {
    private static final Logger LOGGER = Logger.getLogger(AdminCommandPoller.class.getName());

    private final AdminCommandSource source;
    private final AdminCommandHandler handler;
    private final AdminReplySink replySink;
    private final AdminCursorStore cursorStore;
    private final int batchSize;
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "admin-poller");
        thread.setDaemon(true);
        return thread;
    });

    public AdminCommandPoller(
            AdminCommandSource source,
            AdminCommandHandler handler,
            AdminReplySink replySink,
            AdminCursorStore cursorStore,
            int batchSize
    ) {
        this.source = source;
        this.handler = handler;
        this.replySink = replySink;
        this.cursorStore = cursorStore;
        this.batchSize = batchSize;
    }

    public void start(Duration interval) {
        long intervalMillis = Math.max(250, interval.toMillis());
        timerExecutor.scheduleWithFixedDelay(this::pollSafely, 0, intervalMillis, TimeUnit.MILLISECONDS);
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

    /**
     * Handles one batch.
     *
     * @return number of commands handled
     */
    public int pollOnce() {
        long cursor = cursorStore.load();
        List<AdminCommand> commands = source.fetchAfter(cursor, batchSize);
        int handled = 0;
        for (AdminCommand command : commands) {
            AdminReply reply;
            try {
                reply = handler.handle(command.text());
            } catch (StoreUnavailableException e) {
                LOGGER.log(Level.WARNING, "Store unavailable; admin command at " + command.cursor() + " will be retried", e);
                return handled;
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Admin command at " + command.cursor() + " failed", e);
                reply = AdminReply.error("Command failed: " + e.getMessage());
            }
            cursorStore.save(command.cursor());
            handled++;
            LOGGER.info("Admin command from " + command.from() + ": " + command.text()
                    + (reply.success() ? " -> ok" : " -> rejected"));
            try {
                replySink.send(command, reply);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Failed sending reply for admin command at " + command.cursor(), e);
            }
        }
        return handled;
    }

    private void pollSafely() {
        try {
            pollOnce();
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Admin poll failed", e);
        }
    }
}
