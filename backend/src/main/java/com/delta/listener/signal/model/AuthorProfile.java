package com.delta.listener.signal.model;

import java.time.Instant;

public record AuthorProfile(
    String username,
    int karma,
    Instant accountCreatedAt,
    String about,
    String companyDomain,
    String companyName,
    Double companyConfidence,
    String companySource,
    String linkedinUrl,
    String twitterHandle,
    String githubUsername,
    String personalWebsite,
    Instant firstSeenAt,
    Instant lastScannedAt,
    int scanCount,
    int discoveriesCreated,
    Long lastStoryId,
    String lastStoryTitle,
    boolean excluded,
    String exclusionReason
) {}
