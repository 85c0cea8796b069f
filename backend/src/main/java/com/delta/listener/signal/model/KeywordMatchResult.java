package com.delta.listener.signal.model;

import java.util.List;

public record KeywordMatchResult(
    List<KeywordMatch> matches,
    int totalScore,
    List<KeywordCategory> categories,
    List<String> productTags
) {
    public KeywordMatchResult {
        matches = matches == null ? List.of() : List.copyOf(matches);
        categories = categories == null ? List.of() : List.copyOf(categories);
        productTags = productTags == null ? List.of() : List.copyOf(productTags);
    }

    public static KeywordMatchResult empty() {
        return new KeywordMatchResult(List.of(), 0, List.of(), List.of());
    }

    public boolean hasMatches() {
        return !matches.isEmpty();
    }

    public List<String> keywords() {
        return matches.stream().map(KeywordMatch::keyword).toList();
    }
}
