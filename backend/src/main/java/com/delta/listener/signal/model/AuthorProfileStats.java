package com.delta.listener.signal.model;

public record AuthorProfileStats(
    long total,
    long withCompany,
    long withLinkedIn,
    long excluded,
    long scannedLast24h,
    long scannedLast7d,
    double avgKarma
) {}
