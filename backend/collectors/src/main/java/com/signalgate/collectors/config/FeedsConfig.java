package com.signalgate.collectors.config;

import java.time.Duration;
import java.util.List;

public record FeedsConfig(Duration interval, Duration requestTimeout, List<FeedSourceConfig> sources) {
    public static final Duration DEFAULT_INTERVAL = Duration.ofMinutes(5);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);

    public FeedsConfig {
        interval = interval == null ? DEFAULT_INTERVAL : interval;
        requestTimeout = requestTimeout == null ? DEFAULT_REQUEST_TIMEOUT : requestTimeout;
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public List<FeedSourceConfig> enabledSources() {
        return sources.stream().filter(FeedSourceConfig::isEnabled).toList();
    }
}
