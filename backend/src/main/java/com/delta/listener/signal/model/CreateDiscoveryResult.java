package com.delta.listener.signal.model;

public record CreateDiscoveryResult(
    CreateDiscoveryStatus status,
    Long discoveryId,
    Long prospectId,
    String error
) {
    public static CreateDiscoveryResult created(long discoveryId) {
        return new CreateDiscoveryResult(CreateDiscoveryStatus.CREATED, discoveryId, null, null);
    }

    public static CreateDiscoveryResult duplicate(Long discoveryId) {
        return new CreateDiscoveryResult(CreateDiscoveryStatus.DUPLICATE, discoveryId, null, null);
    }

    public static CreateDiscoveryResult autoPromoted(long discoveryId, Long prospectId) {
        return new CreateDiscoveryResult(CreateDiscoveryStatus.AUTO_PROMOTED, discoveryId, prospectId, null);
    }

    public static CreateDiscoveryResult error(Long discoveryId, String message) {
        return new CreateDiscoveryResult(CreateDiscoveryStatus.ERROR, discoveryId, null, message);
    }

    public boolean isSuccess() {
        return status != CreateDiscoveryStatus.ERROR;
    }
}
