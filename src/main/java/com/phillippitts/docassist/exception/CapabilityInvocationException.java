package com.phillippitts.docassist.exception;

/**
 * Thrown when a single capability invocation fails, including timeouts.
 *
 * <p>The fallback executor absorbs these and moves on to the next candidate; they only
 * reach callers wrapped as the cause of a {@link CandidatesExhaustedException}.
 */
public class CapabilityInvocationException extends DocAssistException {

    private final String capability;
    private final boolean timeout;

    public CapabilityInvocationException(String message, String capability) {
        this(message, capability, false, null);
    }

    public CapabilityInvocationException(String message, String capability, Throwable cause) {
        this(message, capability, false, cause);
    }

    private CapabilityInvocationException(String message, String capability, boolean timeout, Throwable cause) {
        super(message + " (capability: " + capability + ")", cause);
        this.capability = capability;
        this.timeout = timeout;
    }

    public static CapabilityInvocationException timeout(String capability, long timeoutMs, Throwable cause) {
        return new CapabilityInvocationException("timed out after " + timeoutMs + "ms", capability, true, cause);
    }

    public String getCapability() {
        return capability;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
