package com.signalgate.lifecycle.dispatch;

import com.signalgate.core.model.Tier;

import java.util.Optional;

public record Destinations(String premium, String free) {
    public Optional<String> forTier(Tier tier) {
        String value = tier == Tier.PREMIUM ? premium : free;
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }
}
