package com.signalgate.lifecycle.dedup;

import com.signalgate.core.model.Article;
import com.signalgate.core.model.RawArticle;
import com.signalgate.lifecycle.support.InMemoryArticleLedger;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeduplicatorTest {
    private final InMemoryArticleLedger ledger = new InMemoryArticleLedger();
    private final Deduplicator deduplicator = new Deduplicator(ledger);

    @Test
    void articleIdIgnoresCaseAndSurroundingWhitespace() {
        assertEquals(
                Deduplicator.articleId("Acme Raises $5M", "Wire"),
                Deduplicator.articleId("  acme raises $5m ", "WIRE")
        );
        assertEquals(16, Deduplicator.articleId("Acme", "Wire").length());
        assertNotEquals(Deduplicator.articleId("Acme", "Wire"), Deduplicator.articleId("Acme", "Other Wire"));
    }

    @Test
    void secondAdmitOfSameArticleIsRejected() {
        RawArticle item = new RawArticle("Acme launches", null, "https://a", Instant.parse("2026-03-02T10:00:00Z"), "Wire");

        assertFalse(deduplicator.seen(item));
        assertTrue(deduplicator.admit(item, true));
        assertTrue(deduplicator.seen(item));
        assertFalse(deduplicator.admit(item, false));
        assertEquals(1, ledger.size());
    }

    @Test
    void ledgerRecordsWhetherArticleProducedASignal() {
        RawArticle item = new RawArticle("Quiet day", null, "https://b", Instant.parse("2026-03-02T10:00:00Z"), "Wire");

        deduplicator.admit(item, false);

        Article stored = ledger.get(Deduplicator.articleId("Quiet day", "Wire")).orElseThrow();
        assertFalse(stored.processed());
        assertEquals("Wire", stored.source());
    }

    @Test
    void releasedArticleCanBeAdmittedAgain() {
        RawArticle item = new RawArticle("Acme files for IPO", null, "https://c", Instant.parse("2026-03-02T10:00:00Z"), "Wire");
        deduplicator.admit(item, true);

        assertTrue(deduplicator.release(item));
        assertFalse(deduplicator.release(item));
        assertFalse(deduplicator.seen(item));
        assertTrue(deduplicator.admit(item, true));
    }
}
