package com.delta.listener.signal.api;

import java.util.List;

public record KeywordApiRequest(
    String keyword,
    String category,
    Integer weight,
    List<String> productTags,
    Boolean active
) {
}
