package com.signalgate.service.admin;

import com.fasterxml.jackson.databind.JsonNode;
import com.signalgate.core.util.JsonUtils;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Inbox file with one command per line, either {@code {"from": "...", "text": "/approve abc"}} or the bare
 * command text. The cursor is the 1-based line number.
 */
public class JsonlAdminCommandSource implements AdminCommandSource {
    private static final Logger LOGGER = Logger.getLogger(JsonlAdminCommandSource.class.getName());

    private final Path inbox;

    public JsonlAdminCommandSource(Path inbox) {
        this.inbox = inbox;
    }

    @Override
    public List<AdminCommand> fetchAfter(long cursor, int limit) {
        if (!Files.exists(inbox)) {
            return List.of();
        }
        List<AdminCommand> commands = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(inbox, StandardCharsets.UTF_8)) {
            String line;
            long lineNumber = 0;
            while ((line = reader.readLine()) != null && commands.size() < limit) {
                lineNumber++;
                if (lineNumber <= cursor || line.isBlank()) {
                    continue;
                }
                commands.add(parse(lineNumber, line.trim()));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading admin inbox " + inbox, e);
        }
        return commands;
    }

    private static AdminCommand parse(long lineNumber, String line) {
        if (!line.startsWith("{")) {
            return new AdminCommand(lineNumber, "inbox", line);
        }
        try {
            JsonNode node = JsonUtils.objectMapper().readTree(line);
            return new AdminCommand(lineNumber, node.path("from").asText("inbox"), node.path("text").asText(""));
        } catch (IOException e) {
            LOGGER.warning("Admin inbox line " + lineNumber + " is not valid JSON; treating it as command text");
            return new AdminCommand(lineNumber, "inbox", line);
        }
    }
}
