package com.phillippitts.docassist.service.policy;

import com.phillippitts.docassist.domain.PolicyConfiguration;

import java.util.Optional;

/**
 * Holds the user's processing policy and capability preference.
 */
public interface PolicyStore {

    PolicyConfiguration load();

    void save(PolicyConfiguration policy);

    /** @return the capability the user pinned, if any */
    Optional<String> pinnedCapability();

    /** Pins a capability; {@code null} or blank clears the pin. */
    void pinCapability(String capabilityId);
}
