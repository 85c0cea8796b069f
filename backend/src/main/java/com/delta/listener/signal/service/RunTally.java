package com.delta.listener.signal.service;

import com.delta.listener.signal.model.CreateDiscoveryResult;
import com.delta.listener.signal.model.RunCounts;
import com.delta.listener.signal.model.RunError;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mutable counters of one scan run. Safe to share between the workers of a run.
 */
public class RunTally {
    private final long runId;
    private final Instant startedAt;
    private final AtomicInteger itemsScanned = new AtomicInteger();
    private final AtomicInteger discoveriesCreated = new AtomicInteger();
    private final AtomicInteger duplicatesSkipped = new AtomicInteger();
    private final AtomicInteger autoPromoted = new AtomicInteger();
    private final List<RunError> errors = new ArrayList<>();
    private final Map<String, Object> cursor = new LinkedHashMap<>();

    public RunTally(long runId, Instant startedAt) {
        this.runId = runId;
        this.startedAt = startedAt;
    }

    public long runId() {
        return runId;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public void scanned() {
        itemsScanned.incrementAndGet();
    }

    public void scanned(int count) {
        itemsScanned.addAndGet(count);
    }

    public void duplicate() {
        duplicatesSkipped.incrementAndGet();
    }

    /**
     * Counts the outcome of one create call; an auto-promoted discovery counts as created too.
     */
    public void record(CreateDiscoveryResult result) {
        switch (result.status()) {
            case CREATED -> discoveriesCreated.incrementAndGet();
            case AUTO_PROMOTED -> {
                discoveriesCreated.incrementAndGet();
                autoPromoted.incrementAndGet();
            }
            case DUPLICATE -> duplicatesSkipped.incrementAndGet();
            case ERROR -> error(result.error() == null ? "discovery creation failed" : result.error());
        }
    }

    public synchronized void error(String message) {
        errors.add(new RunError(message, Instant.now()));
    }

    public synchronized List<RunError> errors() {
        return List.copyOf(errors);
    }

    public synchronized void cursor(String key, Object value) {
        cursor.put(key, value);
    }

    public synchronized Map<String, Object> cursor() {
        return new LinkedHashMap<>(cursor);
    }

    public synchronized RunCounts counts() {
        return new RunCounts(
            itemsScanned.get(),
            discoveriesCreated.get(),
            duplicatesSkipped.get(),
            autoPromoted.get(),
            errors.size()
        );
    }
}
