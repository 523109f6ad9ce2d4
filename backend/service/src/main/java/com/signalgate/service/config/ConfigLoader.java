package com.signalgate.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.signalgate.collectors.config.FeedsConfig;
import com.signalgate.core.util.JsonUtils;
import com.signalgate.lifecycle.config.SignalPolicyConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public final class ConfigLoader {
    private ConfigLoader() {
    }

    public static SignalPolicyConfig loadPolicy(Path configDir) {
        PolicySettings settings = read(configDir.resolve("policy.json"), new TypeReference<>() {
        });
        try {
            return settings.toConfig();
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid policy in " + configDir.resolve("policy.json") + ": " + e.getMessage(), e);
        }
    }

    public static FeedsConfig loadFeeds(Path configDir) {
        return read(configDir.resolve("feeds.json"), new TypeReference<>() {
        });
    }

    public static DispatchConfig loadDispatch(Path configDir) {
        return read(configDir.resolve("dispatch.json"), new TypeReference<>() {
        });
    }

    public static CalendarConfig loadCalendar(Path configDir) {
        return read(configDir.resolve("calendar.json"), new TypeReference<>() {
        });
    }

    public static AdminConfig loadAdmin(Path configDir) {
        return read(configDir.resolve("admin.json"), new TypeReference<>() {
        });
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
