package com.delta.listener.signal.model;

public record DomainCheck(
    String domain,
    boolean isProspect,
    Long prospectId,
    boolean hasDiscovery,
    Long discoveryId,
    DiscoveryStatus discoveryStatus
) {}
