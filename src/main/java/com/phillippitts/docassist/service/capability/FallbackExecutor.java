package com.phillippitts.docassist.service.capability;

import com.phillippitts.docassist.config.properties.CapabilityProperties;
import com.phillippitts.docassist.domain.TaskType;
import com.phillippitts.docassist.exception.CandidatesExhaustedException;
import com.phillippitts.docassist.exception.CapabilityInvocationException;
import com.phillippitts.docassist.exception.CapabilityUnavailableException;
import com.phillippitts.docassist.exception.OperationCancelledException;
import com.phillippitts.docassist.service.capability.event.AllCapabilitiesFailedEvent;
import com.phillippitts.docassist.service.capability.event.CapabilityFailedEvent;
import com.phillippitts.docassist.service.policy.PolicyStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Ranks the available capabilities for a task and tries them in order until one succeeds.
 *
 * <p><b>Ranking:</b> see {@link CandidateRanking}. The pin comes from the {@link PolicyStore},
 * hints from {@code capability.priorities}, availability from the {@link CapabilityProbe}.
 *
 * <p><b>Execution:</b> every candidate failure, timeouts included, is logged, published as a
 * {@link CapabilityFailedEvent} and absorbed. Only exhaustion surfaces, as
 * {@link CandidatesExhaustedException}. An empty available set fails fast with
 * {@link CapabilityUnavailableException}. Cancellation is not a candidate failure and stops
 * the walk immediately.
 *
 * <p><b>Thread Safety:</b> This Spring-managed singleton is stateless and thread-safe.
 */
@Service
public class FallbackExecutor {

    private static final Logger LOG = LogManager.getLogger(FallbackExecutor.class);

    private final CapabilityProbe probe;
    private final PolicyStore policyStore;
    private final Map<TaskType, List<String>> priorities;
    private final InvocationTimeouts timeouts;
    private final Executor executor;
    private final ApplicationEventPublisher publisher;

    public FallbackExecutor(CapabilityProbe probe,
                            PolicyStore policyStore,
                            CapabilityProperties props,
                            @Qualifier("capabilityExecutor") Executor executor,
                            ApplicationEventPublisher publisher) {
        this.probe = Objects.requireNonNull(probe, "probe");
        this.policyStore = Objects.requireNonNull(policyStore, "policyStore");
        this.priorities = Map.copyOf(Objects.requireNonNull(props, "props").getPriorities());
        this.timeouts = InvocationTimeouts.from(props);
        this.executor = Objects.requireNonNull(executor, "executor");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    /**
     * Returns the capability a task would try first.
     *
     * @return the pinned capability if set, else the best-ranked available one, else empty
     */
    public Optional<String> selectBest(TaskType taskType) {
        Optional<String> pinned = policyStore.pinnedCapability();
        if (pinned.isPresent()) {
            return pinned;
        }
        List<String> candidates = rank(taskType, probe.availableCapabilities());
        return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0));
    }

    /**
     * Runs the call against each candidate until one succeeds. Calls are made on the caller's
     * thread with no timeout of their own.
     *
     * @throws CapabilityUnavailableException if nothing is available
     * @throws CandidatesExhaustedException if every candidate failed
     */
    public <T> T tryWithFallback(TaskType taskType, CapabilityCall<T> call) {
        Objects.requireNonNull(call, "call");
        return walk(taskType, call, null);
    }

    /**
     * Runs the call against each candidate until one succeeds, bounding each attempt with the
     * timeout chosen for the payload size. A timed-out attempt counts as a failure.
     *
     * @param payloadChars size of the request payload, selects the normal or long timeout
     */
    public <T> T tryWithFallback(TaskType taskType, int payloadChars, CapabilityCall<T> call) {
        Objects.requireNonNull(call, "call");
        return walk(taskType, call, timeouts.forPayload(payloadChars));
    }

    /** The timeout a call with this payload would get. */
    public Duration timeoutFor(int payloadChars) {
        return timeouts.forPayload(payloadChars);
    }

    private <T> T walk(TaskType taskType, CapabilityCall<T> call, Duration timeout) {
        Objects.requireNonNull(taskType, "taskType");
        List<String> available = probe.availableCapabilities();
        if (available.isEmpty()) {
            LOG.warn("No capabilities available for {}", taskType);
            throw new CapabilityUnavailableException(taskType);
        }
        List<String> candidates = rank(taskType, available);

        Map<String, String> failures = new LinkedHashMap<>();
        Exception last = null;
        for (String candidate : candidates) {
            try {
                LOG.debug("Trying {} with {}", taskType, candidate);
                T result = timeout == null ? call.invoke(candidate) : invokeTimed(candidate, call, timeout);
                LOG.debug("{} succeeded with {}", taskType, candidate);
                return result;
            } catch (OperationCancelledException e) {
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OperationCancelledException("Interrupted while calling " + candidate);
            } catch (Exception e) {
                boolean timedOut = e instanceof CapabilityInvocationException cie && cie.isTimeout();
                LOG.warn("Capability {} failed for {}: {}", candidate, taskType, e.getMessage());
                failures.put(candidate, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
                last = e;
                publisher.publishEvent(new CapabilityFailedEvent(taskType, candidate,
                        timedOut ? "timeout" : e.getClass().getSimpleName(), timedOut, Instant.now()));
            }
        }

        LOG.error("All {} candidates failed for {}", failures.size(), taskType);
        publisher.publishEvent(new AllCapabilitiesFailedEvent(taskType, failures.size(), Instant.now()));
        throw new CandidatesExhaustedException(taskType, failures, last);
    }

    private <T> T invokeTimed(String candidate, CapabilityCall<T> call, Duration timeout) throws Exception {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(() -> {
            try {
                return call.invoke(candidate);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, executor);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            future.cancel(true);
            throw CapabilityInvocationException.timeout(candidate, timeout.toMillis(), te);
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            throw new CapabilityInvocationException("call failed", candidate, cause);
        }
    }

    private List<String> rank(TaskType taskType, List<String> available) {
        List<String> hints = priorities.getOrDefault(taskType, List.of());
        return CandidateRanking.rank(policyStore.pinnedCapability(), hints, available);
    }
}
