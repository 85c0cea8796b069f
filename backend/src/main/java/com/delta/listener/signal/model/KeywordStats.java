package com.delta.listener.signal.model;

import java.util.Map;

public record KeywordStats(
    long total,
    long active,
    Map<String, CategoryCounts> byCategory,
    double avgWeight
) {
    public record CategoryCounts(long total, long active) {}
}
