package com.delta.listener.signal.model;

public record ConfidenceScore(int score, ConfidenceFactors factors) {
    public ConfidenceLevel level() {
        return ConfidenceLevel.fromScore(score);
    }
}
