package com.delta.listener.signal.metrics;

import java.util.LinkedHashMap;
import java.util.Map;

public record ScanMetricsSnapshot(
    long fetches,
    long fetchFailures,
    double fetchMillis,
    long cacheHits,
    long cacheMisses,
    long keywordMatches,
    double keywordMatchMillis,
    long dbOperations,
    double dbMillis
) {
    public ScanMetricsSnapshot since(ScanMetricsSnapshot start) {
        return new ScanMetricsSnapshot(
            fetches - start.fetches,
            fetchFailures - start.fetchFailures,
            fetchMillis - start.fetchMillis,
            cacheHits - start.cacheHits,
            cacheMisses - start.cacheMisses,
            keywordMatches - start.keywordMatches,
            keywordMatchMillis - start.keywordMatchMillis,
            dbOperations - start.dbOperations,
            dbMillis - start.dbMillis
        );
    }

    public double cacheHitRate() {
        long total = cacheHits + cacheMisses;
        return total == 0 ? 0.0 : (double) cacheHits / total;
    }

    /**
     * Flat form stored in the run cursor.
     */
    public Map<String, Object> toCursor() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("fetches", fetches);
        values.put("fetchFailures", fetchFailures);
        values.put("fetchMs", Math.round(fetchMillis));
        values.put("cacheHits", cacheHits);
        values.put("cacheMisses", cacheMisses);
        values.put("keywordMatches", keywordMatches);
        values.put("keywordMatchMs", Math.round(keywordMatchMillis));
        values.put("dbOperations", dbOperations);
        values.put("dbMs", Math.round(dbMillis));
        return values;
    }
}
