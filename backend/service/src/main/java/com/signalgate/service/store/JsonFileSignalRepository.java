package com.signalgate.service.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalgate.core.model.Signal;
import com.signalgate.core.util.JsonUtils;
import com.signalgate.lifecycle.store.SignalRepository;
import com.signalgate.lifecycle.store.StoreUnavailableException;
import com.signalgate.lifecycle.store.UpdateResult;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Signal repository backed by one JSON file. The whole map is held in memory and rewritten through
 * {@link AtomicFileWriter} after every change;
 * reads and compare-and-update share one lock, and a failed write rolls the in-memory change back.
 */
public class JsonFileSignalRepository implements SignalRepository {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Signal> signals = new LinkedHashMap<>();

    public JsonFileSignalRepository(Path file) {
        this.file = file;
        loadIfPresent();
    }

    @Override
    public boolean insertIfAbsent(Signal signal) {
        if (signal.id() == null) {
            throw new IllegalArgumentException("signal id is required");
        }
        lock.lock();
        try {
            if (signals.containsKey(signal.id())) {
                return false;
            }
            signals.put(signal.id(), signal);
            try {
                persist();
            } catch (StoreUnavailableException e) {
                signals.remove(signal.id());
                throw e;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Signal> findById(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(signals.get(id));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public UpdateResult compareAndUpdate(String id, Predicate<Signal> precondition, UnaryOperator<Signal> change) {
        lock.lock();
        try {
            Signal current = signals.get(id);
            if (current == null) {
                return UpdateResult.notFound();
            }
            if (!precondition.test(current)) {
                return UpdateResult.preconditionFailed(current);
            }
            Signal next = change.apply(current);
            if (!current.id().equals(next.id())) {
                throw new IllegalArgumentException("Signal id cannot change on update: " + id);
            }
            signals.put(id, next);
            try {
                persist();
            } catch (StoreUnavailableException e) {
                signals.put(id, current);
                throw e;
            }
            return UpdateResult.updated(next);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Signal> findAll() {
        lock.lock();
        try {
            return new ArrayList<>(signals.values());
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
                List<Signal> loaded = MAPPER.readValue(in, new TypeReference<List<Signal>>() {
                });
                for (Signal signal : loaded) {
                    signals.put(signal.id(), signal);
                }
            }
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed loading signals from " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private void persist() {
        try {
            List<Signal> snapshot = new ArrayList<>(signals.values());
            AtomicFileWriter.write(file, out -> MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, snapshot));
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed writing signals to " + file, e);
        }
    }
}
