package com.signalgate.service.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalgate.core.model.Article;
import com.signalgate.core.util.JsonUtils;
import com.signalgate.lifecycle.store.ArticleLedger;
import com.signalgate.lifecycle.store.StoreUnavailableException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

public class JsonFileArticleLedger implements ArticleLedger {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Article> articles = new LinkedHashMap<>();

    public JsonFileArticleLedger(Path file) {
        this.file = file;
        loadIfPresent();
    }

    @Override
    public boolean insertIfAbsent(Article article) {
        lock.lock();
        try {
            if (articles.containsKey(article.id())) {
                return false;
            }
            articles.put(article.id(), article);
            try {
                persist();
            } catch (StoreUnavailableException e) {
                articles.remove(article.id());
                throw e;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean contains(String articleId) {
        lock.lock();
        try {
            return articles.containsKey(articleId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean remove(String articleId) {
        lock.lock();
        try {
            Article removed = articles.remove(articleId);
            if (removed == null) {
                return false;
            }
            try {
                persist();
            } catch (StoreUnavailableException e) {
                articles.put(articleId, removed);
                throw e;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return articles.size();
        } finally {
            lock.unlock();
        }
    }

    private void loadIfPresent() {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return;
            }
            try (InputStream in = Files.newInputStream(file)) {
                List<Article> loaded = MAPPER.readValue(in, new TypeReference<List<Article>>() {
                });
                for (Article article : loaded) {
                    articles.put(article.id(), article);
                }
            }
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed loading article ledger from " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private void persist() {
        try {
            List<Article> snapshot = new ArrayList<>(articles.values());
            AtomicFileWriter.write(file, out -> MAPPER.writeValue(out, snapshot));
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed writing article ledger to " + file, e);
        }
    }
}
