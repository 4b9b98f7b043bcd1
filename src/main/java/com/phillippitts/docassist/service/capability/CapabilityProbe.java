package com.phillippitts.docassist.service.capability;

import java.util.List;

/**
 * Reports which inference capabilities are reachable right now.
 *
 * <p>Implementations must not throw for an unreachable backend; they report it as absent.
 */
@FunctionalInterface
public interface CapabilityProbe {

    /** @return reachable capability ids in the backend's own order, never {@code null} */
    List<String> availableCapabilities();
}
