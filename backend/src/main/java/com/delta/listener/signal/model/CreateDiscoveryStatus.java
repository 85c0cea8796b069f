package com.delta.listener.signal.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CreateDiscoveryStatus {
    CREATED("created"),
    DUPLICATE("duplicate"),
    AUTO_PROMOTED("auto_promoted"),
    ERROR("error");

    private final String code;

    CreateDiscoveryStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
