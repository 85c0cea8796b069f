package com.delta.listener.signal.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConfidenceLevel {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    VERY_HIGH("very_high");

    private final String code;

    ConfidenceLevel(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static ConfidenceLevel fromScore(int score) {
        if (score >= 80) {
            return VERY_HIGH;
        }
        if (score >= 60) {
            return HIGH;
        }
        if (score >= 40) {
            return MEDIUM;
        }
        return LOW;
    }
}
