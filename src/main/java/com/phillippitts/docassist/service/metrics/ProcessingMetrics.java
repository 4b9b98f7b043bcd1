package com.phillippitts.docassist.service.metrics;

import com.phillippitts.docassist.domain.ClassificationVerdict;
import com.phillippitts.docassist.domain.OperationCategory;
import com.phillippitts.docassist.domain.ProcessingOutcome;
import com.phillippitts.docassist.domain.TaskType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for content processing.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Admission queueing and cancellations per category</li>
 *   <li>Classification verdicts by action and reason</li>
 *   <li>Capability failures, exhaustion and processing latency</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class ProcessingMetrics {

    private static final String METRIC_PREFIX = "docassist";

    private final MeterRegistry registry;

    public ProcessingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Counts an operation that had to wait for a free slot.
     */
    public void incrementQueued(OperationCategory category) {
        Counter.builder(METRIC_PREFIX + ".admission.queued")
                .description("Number of operations queued behind the category ceiling")
                .tag("category", category.id())
                .register(registry)
                .increment();
    }

    /**
     * Counts a cancelled operation.
     *
     * @param wasActive whether the operation had started
     */
    public void incrementCancelled(OperationCategory category, boolean wasActive) {
        Counter.builder(METRIC_PREFIX + ".admission.cancelled")
                .description("Number of cancelled operations")
                .tag("category", category.id())
                .tag("state", wasActive ? "active" : "queued")
                .register(registry)
                .increment();
    }

    /**
     * Counts a classification verdict.
     */
    public void recordVerdict(ClassificationVerdict verdict) {
        Counter.builder(METRIC_PREFIX + ".classification.verdict")
                .description("Classification verdicts by action and reason")
                .tag("action", verdict.action().name().toLowerCase(Locale.ROOT))
                .tag("reason", verdict.reason())
                .register(registry)
                .increment();
    }

    /**
     * Counts a single capability failure.
     *
     * @param reason failure reason (timeout, exception type)
     */
    public void incrementCapabilityFailure(TaskType taskType, String capability, String reason) {
        Counter.builder(METRIC_PREFIX + ".capability.failure")
                .description("Number of failed capability invocations")
                .tag("task", taskType.name().toLowerCase(Locale.ROOT))
                .tag("capability", capability)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Counts a task for which every candidate failed.
     */
    public void incrementExhausted(TaskType taskType) {
        Counter.builder(METRIC_PREFIX + ".capability.exhausted")
                .description("Number of tasks where every capability failed")
                .tag("task", taskType.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    /**
     * Records how long a task took and how it ended.
     *
     * @param durationNanos duration in nanoseconds
     */
    public void recordProcessing(TaskType taskType, ProcessingOutcome.Status status, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".capability.latency")
                .description("Time taken to produce a processing outcome")
                .tag("task", taskType.name().toLowerCase(Locale.ROOT))
                .tag("status", status.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
