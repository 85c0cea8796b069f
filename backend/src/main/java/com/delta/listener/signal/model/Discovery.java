package com.delta.listener.signal.model;

import java.time.Instant;
import java.util.List;

public record Discovery(
    long id,
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
    DiscoveryStatus status,
    Long promotedProspectId,
    String reviewedBy,
    Instant reviewedAt,
    String reviewNotes,
    Instant discoveredAt,
    Instant sourcePublishedAt,
    Instant updatedAt
) {}
