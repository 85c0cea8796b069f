package com.delta.listener.signal.model;

import java.util.Map;

public record RunStats(
    long totalRuns,
    long successfulRuns,
    long failedRuns,
    long totalItemsScanned,
    long totalDiscoveriesCreated,
    long last24hRuns,
    Map<String, SourceRunStats> bySource
) {
    public record SourceRunStats(long runs, long discoveries) {}
}
