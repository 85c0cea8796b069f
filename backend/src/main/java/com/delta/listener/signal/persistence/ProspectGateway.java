package com.delta.listener.signal.persistence;

import com.delta.listener.signal.model.ProspectSeed;

import java.util.Optional;

/**
 * Boundary to the prospect store, which is owned outside the listener.
 */
public interface ProspectGateway {

    Optional<Long> findProspectId(String teamId, String domain);

    /**
     * Returns the existing prospect for (team, domain) or creates a minimal one from the seed.
     */
    ProspectLink findOrCreateProspect(String teamId, String domain, ProspectSeed seed);

    record ProspectLink(long prospectId, boolean created) {}
}
