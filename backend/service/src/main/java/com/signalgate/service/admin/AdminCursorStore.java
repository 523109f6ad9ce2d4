package com.signalgate.service.admin;

import com.fasterxml.jackson.databind.JsonNode;
import com.signalgate.core.util.JsonUtils;
import com.signalgate.service.store.AtomicFileWriter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Persists the position of the last handled admin command.
 */
public class AdminCursorStore {
    private final Path file;

    public AdminCursorStore(Path file) {
        this.file = file;
    }

    public long load() {
        if (!Files.exists(file)) {
            return 0L;
        }
        try {
            JsonNode node = JsonUtils.objectMapper().readTree(Files.readString(file, StandardCharsets.UTF_8));
            return node.path("cursor").asLong(0L);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading admin cursor from " + file, e);
        }
    }

    public void save(long cursor) {
        try {
            byte[] json = JsonUtils.toJson(Map.of("cursor", cursor)).getBytes(StandardCharsets.UTF_8);
            AtomicFileWriter.write(file, out -> out.write(json));
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing admin cursor to " + file, e);
        }
    }
}
