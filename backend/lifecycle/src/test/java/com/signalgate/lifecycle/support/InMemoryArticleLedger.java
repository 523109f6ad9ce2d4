package com.signalgate.lifecycle.support;

import com.signalgate.core.model.Article;
import com.signalgate.lifecycle.store.ArticleLedger;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryArticleLedger implements ArticleLedger {
    private final Map<String, Article> articles = new ConcurrentHashMap<>();

    @Override
    public boolean insertIfAbsent(Article article) {
        return articles.putIfAbsent(article.id(), article) == null;
    }

    @Override
    public boolean contains(String articleId) {
        return articles.containsKey(articleId);
    }

    @Override
    public boolean remove(String articleId) {
        return articles.remove(articleId) != null;
    }

    @Override
    public int size() {
        return articles.size();
    }

    public Optional<Article> get(String articleId) {
        return Optional.ofNullable(articles.get(articleId));
    }
}
