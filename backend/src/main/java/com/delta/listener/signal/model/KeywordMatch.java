package com.delta.listener.signal.model;

import java.util.List;

public record KeywordMatch(
    String keyword,
    KeywordCategory category,
    int weight,
    List<String> productTags,
    String matchedText,
    int position
) {}
