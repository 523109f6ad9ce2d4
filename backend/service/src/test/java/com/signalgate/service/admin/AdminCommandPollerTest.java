package com.signalgate.service.admin;

import com.signalgate.core.model.ApprovalStatus;
import com.signalgate.core.model.SignalType;
import com.signalgate.core.model.TierAssignment;
import com.signalgate.core.util.JsonUtils;
import com.signalgate.service.support.ServiceHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AdminCommandPollerTest {
    private ServiceHarness harness;
    private Path inbox;
    private Path replies;
    private Path cursorFile;

    @BeforeEach
    void setUp() throws Exception {
        harness = new ServiceHarness();
        inbox = harness.dir.resolve("data/admin-inbox.jsonl");
        replies = harness.dir.resolve("data/admin-replies.jsonl");
        cursorFile = harness.dir.resolve("state/admin-cursor.json");
        Files.createDirectories(inbox.getParent());
        harness.repository.insertIfAbsent(
                ServiceHarness.signal("abc123abc123", SignalType.FUNDING, 0.8, TierAssignment.PREMIUM, harness.clock.instant()));
        harness.repository.insertIfAbsent(
                ServiceHarness.signal("def456def456", SignalType.IPO, 0.75, TierAssignment.PREMIUM, harness.clock.instant()));
    }

    @Test
    void handlesNewCommandsInOrderAndRepliesToEach() throws Exception {
        append("{\"from\":\"ops\",\"text\":\"/approve abc123abc123\"}", "", "/reject def456def456 off topic");

        int handled = poller(new AdminCommandHandler(harness.stateMachine), 20).pollOnce();

        assertEquals(2, handled);
        assertEquals(3L, new AdminCursorStore(cursorFile).load());
        List<JsonlAdminReplySink.ReplyLine> lines = replyLines();
        assertEquals(2, lines.size());
        assertEquals("ops", lines.get(0).to());
        assertEquals(1L, lines.get(0).inReplyTo());
        assertTrue(lines.get(0).success());
        assertEquals(3L, lines.get(1).inReplyTo());
        assertEquals(ApprovalStatus.REJECTED, harness.repository.findById("def456def456").orElseThrow().approvalStatus());
    }

    @Test
    void restartNeverReplaysHandledCommands() throws Exception {
        append("/approve abc123abc123");
        poller(new AdminCommandHandler(harness.stateMachine), 20).pollOnce();

        AdminCommandPoller restarted = poller(new AdminCommandHandler(harness.stateMachine), 20);
        assertEquals(0, restarted.pollOnce());
        append("/stats");
        assertEquals(1, restarted.pollOnce());

        assertEquals(1, harness.transport.sentTo(ServiceHarness.PREMIUM).size());
        assertEquals(2, replyLines().size());
    }

    @Test
    void batchSizeBoundsOnePoll() throws Exception {
        append("/pending", "/stats", "/help");
        AdminCommandPoller poller = poller(new AdminCommandHandler(harness.stateMachine), 2);

        assertEquals(2, poller.pollOnce());
        assertEquals(1, poller.pollOnce());
        assertEquals(0, poller.pollOnce());
    }

    @Test
    void storeOutageStopsTheBatchWithoutAdvancing() throws Exception {
        append("/approve abc123abc123", "/help");
        Path signals = harness.dir.resolve("state/signals.json");
        Path parked = harness.dir.resolve("state/signals.parked");
        Files.move(signals, parked);
        Files.createDirectory(signals);

        AdminCommandPoller poller = poller(new AdminCommandHandler(harness.stateMachine), 20);
        assertEquals(0, poller.pollOnce());
        assertEquals(0L, new AdminCursorStore(cursorFile).load());
        assertFalse(Files.exists(replies));

        Files.delete(signals);
        Files.move(parked, signals);
        assertEquals(2, poller.pollOnce());
        assertEquals(ApprovalStatus.APPROVED, harness.repository.findById("abc123abc123").orElseThrow().approvalStatus());
    }

    @Test
    void unexpectedFailureRepliesWithErrorAndMovesOn() throws Exception {
        append("/boom", "/help");
        AdminCommandHandler exploding = new AdminCommandHandler(harness.stateMachine) {
            @Override
            public AdminReply handle(String text) {
                if ("/boom".equals(text)) {
                    throw new IllegalArgumentException("kaboom");
                }
                return super.handle(text);
            }
        };

        assertEquals(2, poller(exploding, 20).pollOnce());

        List<JsonlAdminReplySink.ReplyLine> lines = replyLines();
        assertFalse(lines.get(0).success());
        assertEquals("Command failed: kaboom", lines.get(0).text());
        assertTrue(lines.get(1).success());
        assertEquals(2L, new AdminCursorStore(cursorFile).load());
    }

    private AdminCommandPoller poller(AdminCommandHandler handler, int batchSize) {
        return new AdminCommandPoller(
                new JsonlAdminCommandSource(inbox),
                handler,
                new JsonlAdminReplySink(replies, harness.clock),
                new AdminCursorStore(cursorFile),
                batchSize
        );
    }

    private void append(String... lines) throws Exception {
        Files.write(inbox, List.of(lines), StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    private List<JsonlAdminReplySink.ReplyLine> replyLines() throws Exception {
        return Files.readAllLines(replies, StandardCharsets.UTF_8).stream()
                .map(line -> JsonUtils.fromJson(line, JsonlAdminReplySink.ReplyLine.class))
                .toList();
    }
}
