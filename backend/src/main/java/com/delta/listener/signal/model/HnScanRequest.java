package com.delta.listener.signal.model;

import java.util.Locale;

/**
 * Overrides for one Hacker News scan. Null fields fall back to {@code listener.scan.hn.*}.
 * {@code scanType} is one of front_page, ask_hn, show_hn, new or all.
 */
public record HnScanRequest(
    String scanType,
    Integer maxItems,
    Integer minKeywordScore,
    Boolean includeComments,
    Integer minScoreForComments,
    Integer maxStoriesForComments,
    Integer maxCommentsPerStory,
    Integer maxCommenters,
    Integer autoPromoteThreshold,
    RunType runType
) {
    public static HnScanRequest defaults() {
        return new HnScanRequest(null, null, null, null, null, null, null, null, null, null);
    }

    public String normalizedScanType() {
        if (scanType == null || scanType.isBlank()) {
            return "front_page";
        }
        String normalized = scanType.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "front_page", "ask_hn", "show_hn", "new", "all" -> normalized;
            default -> throw new IllegalArgumentException("Unknown HN scan type: " + scanType);
        };
    }
}
