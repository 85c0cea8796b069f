package com.delta.listener.signal.model;

public record RunCounts(
    int itemsScanned,
    int discoveriesCreated,
    int duplicatesSkipped,
    int autoPromoted,
    int errorsCount
) {}
