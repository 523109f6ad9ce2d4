package com.signalgate.collectors.config;

public record FeedSourceConfig(String name, String url, Boolean enabled) {
    public FeedSourceConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("feed name is required");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("feed url is required for " + name);
        }
        enabled = enabled == null ? Boolean.TRUE : enabled;
    }

    public FeedSourceConfig(String name, String url) {
        this(name, url, true);
    }

    public boolean isEnabled() {
        return enabled;
    }
}
