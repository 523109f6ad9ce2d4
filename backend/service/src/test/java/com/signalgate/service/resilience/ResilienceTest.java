package com.signalgate.service.resilience;

import com.signalgate.core.bus.EventBus;
import com.signalgate.core.events.AlertRaised;
import com.signalgate.core.events.Event;
import com.signalgate.service.store.JsonlEventStore;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ResilienceTest {
    @Test
    void auditLogFailureDoesNotBlockOtherSubscribers() throws Exception {
        List<Event> failedEvents = new CopyOnWriteArrayList<>();
        EventBus bus = new EventBus((event, error) -> failedEvents.add(event));
        JsonlEventStore eventStore = new JsonlEventStore(Files.createTempDirectory("resilience-").resolve("logs/events.jsonl"));
        bus.subscribeAll(eventStore::append);

        AtomicInteger delivered = new AtomicInteger();
        bus.subscribe(AlertRaised.class, event -> delivered.incrementAndGet());

        Map<String, Object> cyclic = new HashMap<>();
        cyclic.put("self", cyclic);
        bus.publish(new AlertRaised(Instant.parse("2026-10-14T09:00:00Z"), "feed", "cyclic payload", cyclic));
        bus.publish(new AlertRaised(Instant.parse("2026-10-14T09:01:00Z"), "feed", "plain payload", Map.of()));

        assertEquals(2, delivered.get());
        assertEquals(1, failedEvents.size());
        assertEquals(1, eventStore.query(Instant.EPOCH, Optional.empty(), 10).size());
    }
}
