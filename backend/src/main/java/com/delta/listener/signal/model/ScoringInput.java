package com.delta.listener.signal.model;

import java.time.Instant;
import java.util.List;

public record ScoringInput(
    List<KeywordMatch> matches,
    SourceType sourceType,
    ExtractionMethod domainSource,
    Instant publishedAt,
    String triggerText,
    String companyDomain,
    String sourceTitle,
    boolean knownCompany
) {
    public ScoringInput {
        matches = matches == null ? List.of() : List.copyOf(matches);
    }
}
