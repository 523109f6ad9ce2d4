package com.signalgate.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalgate.core.events.AlertRaised;
import com.signalgate.core.events.CalendarJobCompleted;
import com.signalgate.core.events.DispatchFailed;
import com.signalgate.core.events.Event;
import com.signalgate.core.events.FeedPolled;
import com.signalgate.core.events.SchedulerTickCompleted;
import com.signalgate.core.events.SchedulerTickStarted;
import com.signalgate.core.events.SignalCreated;
import com.signalgate.core.events.SignalDecided;
import com.signalgate.core.events.SignalDispatched;
import com.signalgate.core.util.JsonUtils;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Envelope codec for the audit log: {@code {"type": ..., "timestamp": ..., "event": {...}}}.
 */
public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Map<String, Class<? extends Event>> TYPES = Stream.<Class<? extends Event>>of(
            SchedulerTickStarted.class,
            SchedulerTickCompleted.class,
            FeedPolled.class,
            SignalCreated.class,
            SignalDecided.class,
            SignalDispatched.class,
            DispatchFailed.class,
            CalendarJobCompleted.class,
            AlertRaised.class
    ).collect(Collectors.toUnmodifiableMap(Class::getSimpleName, Function.identity()));

    private EventCodec() {
    }

    public static List<Class<? extends Event>> allEventTypes() {
        return List.copyOf(TYPES.values());
    }

    public static String toJsonLine(Event event) {
        if (!TYPES.containsKey(event.type())) {
            throw new IllegalArgumentException("Unsupported event type: " + event.type());
        }
        try {
            return MAPPER.writeValueAsString(new StoredEvent(event.type(), event.timestamp(), event));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize event " + event.type(), e);
        }
    }

    public static Event fromJsonLine(String line) {
        try {
            JsonNode node = MAPPER.readTree(line);
            String type = node.path("type").asText();
            Class<? extends Event> eventClass = TYPES.get(type);
            if (eventClass == null) {
                throw new IllegalArgumentException("Unsupported event type: " + type);
            }
            return MAPPER.treeToValue(node.path("event"), eventClass);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to deserialize event", e);
        }
    }

    private record StoredEvent(String type, Instant timestamp, Event event) {
    }
}
