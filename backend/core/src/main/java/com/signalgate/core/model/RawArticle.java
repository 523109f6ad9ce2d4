package com.signalgate.core.model;

import java.time.Instant;

public record RawArticle(
        String title,
        String description,
        String link,
        Instant publishedAt,
        String source
) {
}
