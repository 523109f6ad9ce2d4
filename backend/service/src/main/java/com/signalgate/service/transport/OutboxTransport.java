package com.signalgate.service.transport;

import com.signalgate.core.util.JsonUtils;
import com.signalgate.lifecycle.dispatch.Transport;
import com.signalgate.lifecycle.dispatch.TransportResult;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Development transport: every message is appended to a local JSONL file instead of leaving the machine.
 */
public class OutboxTransport implements Transport {
    private static final Logger LOGGER = Logger.getLogger(OutboxTransport.class.getName());

    private final Path file;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    public OutboxTransport(Path file, Clock clock) {
        this.file = file;
        this.clock = clock;
    }

    @Override
    public TransportResult send(String destination, String message) {
        String line = JsonUtils.toJson(new OutboxEntry(clock.instant(), destination, message));
        lock.lock();
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            try (BufferedWriter writer = Files.newBufferedWriter(
                    file,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
            )) {
                writer.write(line);
                writer.newLine();
            }
            LOGGER.fine(() -> "Outbox message written for " + destination);
            return TransportResult.success("written to " + file);
        } catch (IOException e) {
            return TransportResult.failure("Failed writing outbox " + file + ": " + e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    public record OutboxEntry(Instant timestamp, String destination, String message) {
    }
}
