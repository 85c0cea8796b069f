package com.delta.listener.signal.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Key of a scan run. At most one run per key may be active.
 */
public enum ScanSource {
    HN("hn"),
    HN_PROFILES("hn_profile"),
    RSS("rss");

    private final String code;

    ScanSource(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static ScanSource fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("scan source is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        if ("hn_profiles".equals(normalized)) {
            return HN_PROFILES;
        }
        for (ScanSource source : values()) {
            if (source.code.equals(normalized)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown scan source: " + raw);
    }
}
