package com.delta.listener.signal.extract;

import com.delta.listener.signal.model.CompanySignal;

import java.util.Optional;

/**
 * One independent heuristic for guessing an author's employer from their bio.
 */
public interface CompanySignalExtractor {
    String name();

    Optional<CompanySignal> extract(BioText bio);
}
