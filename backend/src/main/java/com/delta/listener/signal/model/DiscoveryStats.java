package com.delta.listener.signal.model;

import java.util.Map;

public record DiscoveryStats(
    long total,
    Map<String, Long> byStatus,
    Map<String, Long> bySource,
    Map<String, Long> byKeywordCategory,
    double avgConfidence,
    long last24h,
    long last7d
) {}
