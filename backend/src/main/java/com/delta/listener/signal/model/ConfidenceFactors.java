package com.delta.listener.signal.model;

public record ConfidenceFactors(
    int keywordScore,
    int sourceReliability,
    int domainQuality,
    int recency,
    int contextRelevance
) {
    public int sum() {
        return keywordScore + sourceReliability + domainQuality + recency + contextRelevance;
    }
}
