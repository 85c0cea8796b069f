package com.delta.listener.signal.metrics;

import com.delta.listener.signal.http.FetchOptions;
import com.delta.listener.signal.http.FetchRequest;
import com.delta.listener.signal.http.MetricsInterceptor;
import com.delta.listener.signal.model.HttpFetchResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ScanMetricsTest {
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final ScanMetrics metrics = new ScanMetrics(registry);

    @Test
    void interceptorTagsFetchOutcome() {
        MetricsInterceptor interceptor = new MetricsInterceptor(metrics);
        FetchRequest request = new FetchRequest(
            "https://example.com",
            URI.create("https://example.com"),
            FetchOptions.of(1000, 0, 0),
            0,
            null
        );

        interceptor.intercept(request, next -> response(200, null));
        interceptor.intercept(request, next -> response(503, null));
        interceptor.intercept(request, next -> response(0, "timeout"));

        assertEquals(1, registry.get(ScanMetrics.FETCH).tag("outcome", "success").timer().count());
        assertEquals(1, registry.get(ScanMetrics.FETCH).tag("outcome", "http_error").timer().count());
        assertEquals(1, registry.get(ScanMetrics.FETCH).tag("outcome", "failure").timer().count());
        assertEquals(3, metrics.snapshot().fetches());
        assertEquals(1, metrics.snapshot().fetchFailures());
    }

    @Test
    void snapshotSinceCoversOnlyTheRunWindow() {
        metrics.cacheLookup("hn_items", true);
        metrics.timeKeywordMatch(() -> "before");
        ScanMetricsSnapshot start = metrics.snapshot();

        metrics.cacheLookup("hn_items", true);
        metrics.cacheLookup("hn_users", false);
        metrics.cacheLookup("hn_users", false);
        metrics.timeKeywordMatch(() -> "during");
        String stored = metrics.timeDb("create_discovery", () -> "row");

        ScanMetricsSnapshot run = metrics.snapshot().since(start);

        assertEquals("row", stored);
        assertEquals(1, run.cacheHits());
        assertEquals(2, run.cacheMisses());
        assertEquals(1, run.keywordMatches());
        assertEquals(1, run.dbOperations());
        assertThat(run.cacheHitRate()).isCloseTo(1.0 / 3, within(1e-9));
        assertThat(run.toCursor()).containsEntry("cacheMisses", 2L).containsEntry("dbOperations", 1L);
        assertEquals(1, registry.get(ScanMetrics.DB).tag("operation", "create_discovery").timer().count());
    }

    private static HttpFetchResult response(int status, String errorCode) {
        if (errorCode != null) {
            return HttpFetchResult.error("https://example.com", Instant.now(), errorCode, "no answer");
        }
        return new HttpFetchResult(
            "https://example.com", URI.create("https://example.com"), status, "", "text/plain",
            Instant.now(), Duration.ZERO, null, null
        );
    }
}
