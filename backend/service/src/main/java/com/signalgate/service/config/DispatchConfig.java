package com.signalgate.service.config;

import com.signalgate.lifecycle.dispatch.Destinations;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Where rendered messages go. {@code transport} is {@code webhook} (HTTP POST per message) or {@code outbox}
 * (append to a local JSONL file, for development).
 */
public record DispatchConfig(
        String transport,
        String premiumDestination,
        String freeDestination,
        String outboxFile,
        Duration requestTimeout
) {
    public static final String WEBHOOK = "webhook";
    public static final String OUTBOX = "outbox";

    public DispatchConfig {
        transport = transport == null || transport.isBlank() ? null : transport.trim().toLowerCase(Locale.ROOT);
        if (transport != null && !WEBHOOK.equals(transport) && !OUTBOX.equals(transport)) {
            throw new IllegalArgumentException("Unknown transport '" + transport + "', expected webhook or outbox");
        }
        outboxFile = outboxFile == null || outboxFile.isBlank() ? "data/outbox.jsonl" : outboxFile;
        requestTimeout = requestTimeout == null ? Duration.ofSeconds(10) : requestTimeout;
    }

    /**
     * Applies {@code PREMIUM_DESTINATION} and {@code FREE_DESTINATION} from the environment, and picks the
     * outbox transport in dev mode when none is configured.
     */
    public DispatchConfig resolve(Map<String, String> environment, boolean devMode) {
        String premium = environment.getOrDefault("PREMIUM_DESTINATION", premiumDestination);
        String free = environment.getOrDefault("FREE_DESTINATION", freeDestination);
        String selected = transport != null ? transport : (devMode ? OUTBOX : WEBHOOK);
        return new DispatchConfig(selected, premium, free, outboxFile, requestTimeout);
    }

    public Destinations destinations() {
        return new Destinations(premiumDestination, freeDestination);
    }

    public boolean outbox() {
        return OUTBOX.equals(transport);
    }
}
