package com.delta.listener.signal.model;

import java.util.List;
import java.util.Map;

public record ScanSummary(
    long runId,
    ScanSource source,
    RunStatus status,
    int itemsScanned,
    int discoveriesCreated,
    int duplicatesSkipped,
    int autoPromoted,
    List<RunError> errors,
    long durationMs,
    Map<String, Object> cursor
) {}
