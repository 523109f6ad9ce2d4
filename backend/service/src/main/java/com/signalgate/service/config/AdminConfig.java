package com.signalgate.service.config;

import java.time.Duration;

public record AdminConfig(
        Integer apiPort,
        Duration pollInterval,
        Integer batchSize,
        String inboxFile,
        String outboxFile,
        String cursorFile
) {
    public AdminConfig {
        apiPort = apiPort == null ? 8080 : apiPort;
        pollInterval = pollInterval == null ? Duration.ofSeconds(15) : pollInterval;
        batchSize = batchSize == null ? 20 : batchSize;
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        inboxFile = inboxFile == null || inboxFile.isBlank() ? "data/admin-inbox.jsonl" : inboxFile;
        outboxFile = outboxFile == null || outboxFile.isBlank() ? "data/admin-replies.jsonl" : outboxFile;
        cursorFile = cursorFile == null || cursorFile.isBlank() ? "state/admin-cursor.json" : cursorFile;
    }
}
