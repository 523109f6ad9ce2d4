package com.signalgate.lifecycle.store;

import com.signalgate.core.model.Article;

public interface ArticleLedger {
    /**
     * @return {@code true} if the article was recorded, {@code false} if its id was already present
     */
    boolean insertIfAbsent(Article article);

    boolean contains(String articleId);

    /**
     * Drops an entry so the article can be admitted again.
     *
     * @return {@code true} if an entry was removed
     */
    boolean remove(String articleId);

    int size();
}
