package com.delta.listener.signal.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ScanRun(
    long id,
    ScanSource source,
    RunType runType,
    Instant startedAt,
    Instant completedAt,
    RunStatus status,
    int itemsScanned,
    int discoveriesCreated,
    int duplicatesSkipped,
    int autoPromoted,
    int errorsCount,
    List<RunError> errorDetails,
    Map<String, Object> cursorData
) {}
