package com.delta.listener.signal.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SourceType {
    HN_POST("hn_post", 15),
    HN_COMMENT("hn_comment", 8),
    HN_PROFILE("hn_profile", 12),
    NEWS_ARTICLE("news_article", 18),
    REDDIT_POST("reddit_post", 12),
    REDDIT_COMMENT("reddit_comment", 6),
    TWITTER("twitter", 10),
    STATUS_PAGE("status_page", 20),
    GITHUB_ISSUE("github_issue", 15),
    LIST_ANALYSIS("list_analysis", 12),
    MANUAL("manual", 10);

    private final String code;
    private final int reliability;

    SourceType(String code, int reliability) {
        this.code = code;
        this.reliability = reliability;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public int reliability() {
        return reliability;
    }

    @JsonCreator
    public static SourceType fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("source type is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (SourceType type : values()) {
            if (type.code.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown source type: " + raw);
    }
}
