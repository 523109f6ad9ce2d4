package com.signalgate.core.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalgate.core.model.Signal;
import com.signalgate.core.model.SignalType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonUtilsTest {
    @Test
    void objectMapperIsSingletonAndConfigured() {
        ObjectMapper first = JsonUtils.objectMapper();
        ObjectMapper second = JsonUtils.objectMapper();

        assertSame(first, second);
        assertFalse(first.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    @Test
    void instantsAreWrittenAsIsoStrings() {
        String json = JsonUtils.toJson(new Payload("ok", null, Instant.parse("2026-02-01T00:00:00Z")));

        assertTrue(json.contains("\"createdAt\":\"2026-02-01T00:00:00Z\""));
        assertFalse(json.contains("optional"));
    }

    @Test
    void signalSurvivesJsonWithEvidenceOrder() {
        Signal signal = Signal.draft(
                SignalType.FUNDING,
                "techwire",
                "Acme raises $20 million",
                "https://techwire.example/acme",
                "Acme raises $20 million",
                0.65,
                Instant.parse("2026-10-01T08:00:00Z"),
                "Funding round",
                List.of("first", "second", "third")
        ).withId("abc123def456");

        Signal parsed = JsonUtils.fromJson(JsonUtils.toJson(signal), Signal.class);

        assertEquals(signal, parsed);
        assertEquals(List.of("first", "second", "third"), parsed.evidence());
    }

    @Test
    void fromJsonWrapsParseErrors() {
        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> JsonUtils.fromJson("{nope", Payload.class));
        assertTrue(ex.getMessage().contains("Payload"));
    }

    private record Payload(String name, String optional, Instant createdAt) {
    }
}
