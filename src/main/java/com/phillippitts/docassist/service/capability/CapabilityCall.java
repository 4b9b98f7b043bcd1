package com.phillippitts.docassist.service.capability;

/**
 * One attempt at a task against a specific capability.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface CapabilityCall<T> {

    T invoke(String capabilityId) throws Exception;
}
