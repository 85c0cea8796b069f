package com.delta.listener.signal.model;

/**
 * Fields written on every profile scan. {@code discoveryCreated} bumps the running discovery count.
 */
public record AuthorProfileUpsert(
    HnUser user,
    AuthorCompanyInfo companyInfo,
    Long storyId,
    String storyTitle,
    boolean discoveryCreated
) {}
