package com.delta.listener.signal.model;

/**
 * One extractor's opinion about where an author works.
 */
public record CompanySignal(
    String domain,
    String name,
    double confidence,
    CompanySource source,
    String extractor
) {
    public CompanySignal withConfidence(double value) {
        return new CompanySignal(domain, name, value, source, extractor);
    }
}
