package com.signalgate.service.store;

import com.signalgate.core.events.Event;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only audit log of lifecycle events.
 */
public interface EventStore {
    void append(Event event);

    List<Event> query(Instant since, Optional<String> type, int limit);
}
