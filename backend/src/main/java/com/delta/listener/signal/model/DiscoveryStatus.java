package com.delta.listener.signal.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Review lifecycle of a discovery. Only {@code new} and {@code reviewing} may move; the other states are final.
 */
public enum DiscoveryStatus {
    NEW("new"),
    REVIEWING("reviewing"),
    PROMOTED("promoted"),
    DISMISSED("dismissed"),
    DUPLICATE("duplicate");

    private final String code;

    DiscoveryStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public boolean isTerminal() {
        return this == PROMOTED || this == DISMISSED || this == DUPLICATE;
    }

    public boolean canTransitionTo(DiscoveryStatus target) {
        if (target == null || target == this || isTerminal()) {
            return false;
        }
        if (this == NEW) {
            return true;
        }
        return target != NEW;
    }

    @JsonCreator
    public static DiscoveryStatus fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("status is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (DiscoveryStatus status : values()) {
            if (status.code.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown discovery status: " + raw);
    }
}
