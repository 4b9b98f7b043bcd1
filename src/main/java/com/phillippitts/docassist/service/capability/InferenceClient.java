package com.phillippitts.docassist.service.capability;

import com.phillippitts.docassist.exception.CapabilityInvocationException;
import com.phillippitts.docassist.exception.OperationCancelledException;
import com.phillippitts.docassist.service.admission.CancellationToken;

import java.time.Duration;

/** Transport to an inference backend. */
public interface InferenceClient {

    /**
     * Runs a single non-streaming chat completion.
     *
     * @param capabilityId model to use
     * @param systemPrompt instructions
     * @param userPrompt content or question
     * @param timeout time allowed for the whole call
     * @return model answer with reasoning blocks removed
     * @throws CapabilityInvocationException if the call fails or times out
     */
    String complete(String capabilityId, String systemPrompt, String userPrompt, Duration timeout);

    /**
     * Same as {@link #complete(String, String, String, Duration)}, bound to an operation's
     * cancellation token. Implementations that can abort an in-flight call should do so when
     * the token is cancelled; this default only checks the token before calling.
     *
     * @throws OperationCancelledException if the token is or becomes cancelled
     */
    default String complete(String capabilityId, String systemPrompt, String userPrompt, Duration timeout,
                            CancellationToken token) {
        token.throwIfCancelled();
        return complete(capabilityId, systemPrompt, userPrompt, timeout);
    }
}
