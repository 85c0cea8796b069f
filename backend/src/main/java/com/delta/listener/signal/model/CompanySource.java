package com.delta.listener.signal.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CompanySource {
    ABOUT_URL("about_url"),
    ABOUT_TEXT("about_text"),
    EMAIL_DOMAIN("email_domain"),
    GITHUB("github");

    private final String code;

    CompanySource(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static CompanySource fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (CompanySource value : values()) {
            if (value.code.equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown company source: " + raw);
    }
}
