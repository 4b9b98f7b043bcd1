package com.phillippitts.docassist.service.capability;

import com.phillippitts.docassist.config.properties.CapabilityProperties;

import java.time.Duration;
import java.util.Objects;

/**
 * Picks the per-call timeout for a capability invocation: payloads above the configured size
 * get the long variant.
 */
public final class InvocationTimeouts {

    private final Duration normal;
    private final Duration longRunning;
    private final int longPayloadThresholdChars;

    public InvocationTimeouts(Duration normal, Duration longRunning, int longPayloadThresholdChars) {
        this.normal = Objects.requireNonNull(normal, "normal");
        this.longRunning = Objects.requireNonNull(longRunning, "longRunning");
        this.longPayloadThresholdChars = longPayloadThresholdChars;
    }

    public static InvocationTimeouts from(CapabilityProperties props) {
        return new InvocationTimeouts(
                Duration.ofMillis(props.getRequestTimeoutMs()),
                Duration.ofMillis(props.getLongRequestTimeoutMs()),
                props.getLongPayloadThresholdChars());
    }

    public Duration forPayload(int payloadChars) {
        return payloadChars > longPayloadThresholdChars ? longRunning : normal;
    }
}
