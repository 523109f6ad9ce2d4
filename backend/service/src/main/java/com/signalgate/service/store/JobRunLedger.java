package com.signalgate.service.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalgate.core.util.JsonUtils;
import com.signalgate.lifecycle.store.StoreUnavailableException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Last completed period per calendar job, e.g. {@code weekly-digest -> 2026-W42}.
 */
public class JobRunLedger {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, String> lastPeriods = new TreeMap<>();

    public JobRunLedger(Path file) {
        this.file = file;
        loadIfPresent();
    }

    public Optional<String> lastPeriod(String jobName) {
        lock.lock();
        try {
            return Optional.ofNullable(lastPeriods.get(jobName));
        } finally {
            lock.unlock();
        }
    }

    public void record(String jobName, String periodKey) {
        lock.lock();
        try {
            String previous = lastPeriods.put(jobName, periodKey);
            try {
                persist();
            } catch (StoreUnavailableException e) {
                if (previous == null) {
                    lastPeriods.remove(jobName);
                } else {
                    lastPeriods.put(jobName, previous);
                }
                throw e;
            }
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
                lastPeriods.putAll(MAPPER.readValue(in, new TypeReference<Map<String, String>>() {
                }));
            }
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed loading job runs from " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private void persist() {
        try {
            AtomicFileWriter.write(file, out -> MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, lastPeriods));
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed writing job runs to " + file, e);
        }
    }
}
