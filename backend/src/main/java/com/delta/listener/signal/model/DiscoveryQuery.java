package com.delta.listener.signal.model;

import java.util.List;

public record DiscoveryQuery(
    List<DiscoveryStatus> statuses,
    SourceType sourceType,
    Integer minConfidence,
    int limit,
    int offset,
    String orderBy,
    boolean ascending
) {
    public DiscoveryQuery {
        statuses = statuses == null ? List.of() : List.copyOf(statuses);
        limit = limit <= 0 ? 50 : Math.min(limit, 500);
        offset = Math.max(0, offset);
        orderBy = "confidence_score".equals(orderBy) ? "confidence_score" : "discovered_at";
    }
}
