package com.delta.listener.signal.model;

import java.time.Instant;
import java.util.List;

public record KeywordDefinition(
    Long id,
    String keyword,
    KeywordCategory category,
    int weight,
    boolean active,
    List<String> productTags,
    Instant createdAt,
    Instant updatedAt
) {
    public KeywordDefinition {
        productTags = productTags == null ? List.of() : List.copyOf(productTags);
    }

    public static KeywordDefinition of(String keyword, KeywordCategory category, int weight, List<String> productTags) {
        return new KeywordDefinition(null, keyword, category, weight, true, productTags, null, null);
    }
}
