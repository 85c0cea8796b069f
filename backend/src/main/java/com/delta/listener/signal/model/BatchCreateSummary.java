package com.delta.listener.signal.model;

import java.util.List;

public record BatchCreateSummary(
    int created,
    int duplicates,
    int autoPromoted,
    int errors,
    List<CreateDiscoveryResult> results
) {}
