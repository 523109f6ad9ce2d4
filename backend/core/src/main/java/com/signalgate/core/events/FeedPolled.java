package com.signalgate.core.events;

import java.time.Instant;

public record FeedPolled(
        Instant timestamp,
        String source,
        boolean success,
        int itemCount,
        int signalsCreated
) implements Event {
    @Override
    public String type() {
        return "FeedPolled";
    }
}
