package com.signalgate.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Dedup ledger entry. Written once and never updated.
 */
public record Article(
        String id,
        String title,
        String source,
        Instant publishedDate,
        boolean processed
) {
    public Article {
        Objects.requireNonNull(id, "id is required");
    }
}
