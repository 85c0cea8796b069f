package com.delta.listener.signal.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Micrometer meters for the scan pipeline: outbound fetches, HN cache lookups, keyword matching and the
 * database writes done per discovery. Meters are cumulative; a run reads its own share through
 * {@link #snapshot()} taken at start and end.
 */
@Component
public class ScanMetrics {
    public static final String FETCH = "listener.http.fetch";
    public static final String CACHE = "listener.cache.lookups";
    public static final String KEYWORD_MATCH = "listener.keywords.match";
    public static final String DB = "listener.db.operation";

    private final MeterRegistry meterRegistry;
    private final Timer keywordMatchTimer;

    public ScanMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.keywordMatchTimer = Timer.builder(KEYWORD_MATCH)
            .description("Time spent matching text against the keyword taxonomy")
            .register(meterRegistry);
    }

    /**
     * Meters kept in memory only, for components built outside the application context.
     */
    public static ScanMetrics inMemory() {
        return new ScanMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry registry() {
        return meterRegistry;
    }

    public Timer.Sample startFetch() {
        return Timer.start(meterRegistry);
    }

    /**
     * @param outcome {@code success}, {@code http_error} or {@code failure}
     */
    public void stopFetch(Timer.Sample sample, String outcome) {
        sample.stop(Timer.builder(FETCH)
            .description("Outbound HTTP fetches including retries")
            .tag("outcome", outcome)
            .register(meterRegistry));
    }

    public void cacheLookup(String cache, boolean hit) {
        Counter.builder(CACHE)
            .description("HN cache lookups")
            .tag("cache", cache)
            .tag("result", hit ? "hit" : "miss")
            .register(meterRegistry)
            .increment();
    }

    public <T> T timeKeywordMatch(Supplier<T> work) {
        return keywordMatchTimer.record(work);
    }

    public <T> T timeDb(String operation, Supplier<T> work) {
        return Timer.builder(DB)
            .description("Database work done by the scan pipeline")
            .tag("operation", operation)
            .register(meterRegistry)
            .record(work);
    }

    public ScanMetricsSnapshot snapshot() {
        Collection<Timer> fetches = meterRegistry.find(FETCH).timers();
        Collection<Timer> failedFetches = meterRegistry.find(FETCH).tag("outcome", "failure").timers();
        Collection<Timer> db = meterRegistry.find(DB).timers();
        return new ScanMetricsSnapshot(
            count(fetches),
            count(failedFetches),
            millis(fetches),
            counterTotal("hit"),
            counterTotal("miss"),
            keywordMatchTimer.count(),
            keywordMatchTimer.totalTime(TimeUnit.MILLISECONDS),
            count(db),
            millis(db)
        );
    }

    private long counterTotal(String result) {
        return (long) meterRegistry.find(CACHE).tag("result", result).counters().stream()
            .mapToDouble(Counter::count)
            .sum();
    }

    private static long count(Collection<Timer> timers) {
        return timers.stream().mapToLong(Timer::count).sum();
    }

    private static double millis(Collection<Timer> timers) {
        return timers.stream().mapToDouble(timer -> timer.totalTime(TimeUnit.MILLISECONDS)).sum();
    }
}
