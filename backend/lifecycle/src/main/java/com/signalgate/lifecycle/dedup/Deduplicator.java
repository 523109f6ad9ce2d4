package com.signalgate.lifecycle.dedup;

import com.signalgate.core.model.Article;
import com.signalgate.core.model.RawArticle;
import com.signalgate.core.util.HashingUtils;
import com.signalgate.lifecycle.store.ArticleLedger;

import java.util.Locale;

public class Deduplicator {
    private static final int ARTICLE_ID_LENGTH = 16;

    private final ArticleLedger ledger;

    public Deduplicator(ArticleLedger ledger) {
        this.ledger = ledger;
    }

    public static String articleId(String title, String source) {
        String normalizedTitle = title == null ? "" : title.trim().toLowerCase(Locale.ROOT);
        String normalizedSource = source == null ? "" : source.trim().toLowerCase(Locale.ROOT);
        return HashingUtils.shortHash(normalizedTitle + "|" + normalizedSource, ARTICLE_ID_LENGTH);
    }

    public boolean seen(RawArticle article) {
        return ledger.contains(articleId(article.title(), article.source()));
    }

    /**
     * Records the article in the ledger.
     *
     * @return {@code false} when the article had already been recorded, in which case nothing changes
     */
    public boolean admit(RawArticle article, boolean processed) {
        return ledger.insertIfAbsent(new Article(
                articleId(article.title(), article.source()),
                article.title(),
                article.source(),
                article.publishedAt(),
                processed
        ));
    }

    /**
     * Undoes {@link #admit} for an article whose signal could not be created.
     */
    public boolean release(RawArticle article) {
        return ledger.remove(articleId(article.title(), article.source()));
    }
}
