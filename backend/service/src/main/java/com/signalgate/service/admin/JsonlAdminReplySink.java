package com.signalgate.service.admin;

import com.signalgate.core.util.JsonUtils;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

public class JsonlAdminReplySink implements AdminReplySink {
    private final Path outbox;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlAdminReplySink(Path outbox, Clock clock) {
        this.outbox = outbox;
        this.clock = clock;
    }

    @Override
    public void send(AdminCommand command, AdminReply reply) {
        String line = JsonUtils.toJson(new ReplyLine(clock.instant(), command.cursor(), command.from(),
                reply.success(), reply.text()));
        lock.lock();
        try {
            Files.createDirectories(outbox.toAbsolutePath().getParent());
            try (BufferedWriter writer = Files.newBufferedWriter(
                    outbox,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
            )) {
                writer.write(line);
                writer.newLine();
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing admin reply to " + outbox, e);
        } finally {
            lock.unlock();
        }
    }

    public record ReplyLine(Instant timestamp, long inReplyTo, String to, boolean success, String text) {
    }
}
