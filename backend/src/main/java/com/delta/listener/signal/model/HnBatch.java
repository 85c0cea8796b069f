package com.delta.listener.signal.model;

import java.util.List;

public record HnBatch(List<SourceItem> items, int scannedCount, long lastItemId) {
    public static HnBatch empty(long lastItemId) {
        return new HnBatch(List.of(), 0, lastItemId);
    }
}
