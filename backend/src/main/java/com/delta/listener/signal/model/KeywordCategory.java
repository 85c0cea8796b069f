package com.delta.listener.signal.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum KeywordCategory {
    PAIN_SIGNAL("pain_signal"),
    REGULATORY("regulatory"),
    COST("cost"),
    COMPETITOR("competitor");

    private final String code;

    KeywordCategory(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static KeywordCategory fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (KeywordCategory value : values()) {
            if (value.code.equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown keyword category: " + raw);
    }
}
