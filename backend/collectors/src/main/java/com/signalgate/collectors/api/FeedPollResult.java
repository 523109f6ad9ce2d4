package com.signalgate.collectors.api;

import com.signalgate.core.model.RawArticle;

import java.util.List;

public record FeedPollResult(String source, boolean success, List<RawArticle> items, String error) {
    public FeedPollResult {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static FeedPollResult success(String source, List<RawArticle> items) {
        return new FeedPollResult(source, true, items, null);
    }

    public static FeedPollResult failure(String source, String error) {
        return new FeedPollResult(source, false, List.of(), error);
    }
}
