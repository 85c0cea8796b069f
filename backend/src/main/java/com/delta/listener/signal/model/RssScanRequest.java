package com.delta.listener.signal.model;

import java.util.List;

public record RssScanRequest(
    List<String> feedNames,
    Integer maxArticles,
    Integer maxAgeHours,
    Integer minKeywordScore,
    Integer autoPromoteThreshold,
    RunType runType
) {
    public static RssScanRequest defaults() {
        return new RssScanRequest(null, null, null, null, null, null);
    }
}
