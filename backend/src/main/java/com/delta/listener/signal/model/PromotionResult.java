package com.delta.listener.signal.model;

public record PromotionResult(
    long discoveryId,
    Long prospectId,
    DiscoveryStatus status,
    boolean createdProspect
) {}
