package com.signalgate.collectors.api;

import com.signalgate.collectors.config.FeedSourceConfig;

import java.util.concurrent.CompletableFuture;

/**
 * Fetches recent items from one configured feed. Implementations never complete exceptionally: fetch and
 * parse problems are reported through {@link FeedPollResult#failure}.
 */
public interface FeedSource {
    String name();

    CompletableFuture<FeedPollResult> poll(FeedSourceConfig source);
}
