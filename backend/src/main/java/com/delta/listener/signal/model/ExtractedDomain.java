package com.delta.listener.signal.model;

public record ExtractedDomain(
    String domain,
    ExtractionMethod method,
    double confidence,
    String context
) {
    public ExtractedDomain withConfidence(double value) {
        return new ExtractedDomain(domain, method, value, context);
    }
}
