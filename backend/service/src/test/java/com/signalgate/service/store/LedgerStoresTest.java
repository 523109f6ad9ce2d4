package com.signalgate.service.store;

import com.signalgate.core.model.Article;
import com.signalgate.lifecycle.store.StoreUnavailableException;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LedgerStoresTest {
    @Test
    void articleLedgerKeepsFirstWriteAndSurvivesRestart() throws Exception {
        Path file = Files.createTempDirectory("article-ledger-").resolve("state/articles.json");
        JsonFileArticleLedger ledger = new JsonFileArticleLedger(file);
        Instant published = Instant.parse("2026-10-14T07:00:00Z");

        assertTrue(ledger.insertIfAbsent(new Article("0123456789abcdef", "Title", "Wire", published, true)));
        assertFalse(ledger.insertIfAbsent(new Article("0123456789abcdef", "Title again", "Wire", published, false)));

        JsonFileArticleLedger reloaded = new JsonFileArticleLedger(file);
        assertTrue(reloaded.contains("0123456789abcdef"));
        assertFalse(reloaded.contains("fedcba9876543210"));
        assertEquals(1, reloaded.size());
    }

    @Test
    void removedArticleStaysRemovedAfterRestart() throws Exception {
        Path file = Files.createTempDirectory("article-ledger-remove-").resolve("articles.json");
        JsonFileArticleLedger ledger = new JsonFileArticleLedger(file);
        Instant published = Instant.parse("2026-10-14T07:00:00Z");
        ledger.insertIfAbsent(new Article("0123456789abcdef", "Title", "Wire", published, true));

        assertTrue(ledger.remove("0123456789abcdef"));
        assertFalse(ledger.remove("0123456789abcdef"));

        JsonFileArticleLedger reloaded = new JsonFileArticleLedger(file);
        assertFalse(reloaded.contains("0123456789abcdef"));
        assertEquals(0, reloaded.size());
    }

    @Test
    void corruptArticleLedgerIsStoreUnavailable() throws Exception {
        Path file = Files.createTempDirectory("article-ledger-corrupt-").resolve("articles.json");
        Files.writeString(file, "nope");

        assertThrows(StoreUnavailableException.class, () -> new JsonFileArticleLedger(file));
    }

    @Test
    void jobRunLedgerRemembersLastPeriodPerJob() throws Exception {
        Path file = Files.createTempDirectory("job-runs-").resolve("state/job-runs.json");
        JobRunLedger ledger = new JobRunLedger(file);

        assertEquals(Optional.empty(), ledger.lastPeriod("weekly-digest"));
        ledger.record("weekly-digest", "2026-W41");
        ledger.record("weekly-digest", "2026-W42");
        ledger.record("monthly-digest", "2026-10");

        JobRunLedger reloaded = new JobRunLedger(file);
        assertEquals(Optional.of("2026-W42"), reloaded.lastPeriod("weekly-digest"));
        assertEquals(Optional.of("2026-10"), reloaded.lastPeriod("monthly-digest"));
    }
}
