package com.delta.listener.signal.model;

import java.time.Instant;
import java.util.List;

public record DiscoveryCandidate(
    String companyDomain,
    String companyName,
    SourceType sourceType,
    String sourceUrl,
    String sourceTitle,
    String triggerText,
    List<String> keywordsMatched,
    KeywordCategory keywordCategory,
    int confidenceScore,
    List<String> productTags,
    Instant sourcePublishedAt
) {
    public DiscoveryCandidate {
        keywordsMatched = keywordsMatched == null ? List.of() : List.copyOf(keywordsMatched);
        productTags = productTags == null ? List.of() : List.copyOf(productTags);
        confidenceScore = Math.max(0, Math.min(100, confidenceScore));
    }
}
