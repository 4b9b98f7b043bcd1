package com.phillippitts.docassist.service.metrics;

import com.phillippitts.docassist.domain.ClassificationVerdict;
import com.phillippitts.docassist.domain.OperationCategory;
import com.phillippitts.docassist.domain.ProcessingOutcome;
import com.phillippitts.docassist.domain.TaskType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ProcessingMetricsTest {

    private MeterRegistry registry;
    private ProcessingMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ProcessingMetrics(registry);
    }

    @Test
    void shouldCountQueuedPerCategory() {
        metrics.incrementQueued(OperationCategory.CONTENT_SUMMARIZATION);
        metrics.incrementQueued(OperationCategory.CONTENT_SUMMARIZATION);

        Counter counter = registry.find("docassist.admission.queued")
                .tag("category", "content-summarization")
                .counter();

        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(2.0);
    }

    @Test
    void shouldTagCancellationsByState() {
        metrics.incrementCancelled(OperationCategory.INTERACTIVE_QUERY, true);
        metrics.incrementCancelled(OperationCategory.INTERACTIVE_QUERY, false);
        metrics.incrementCancelled(OperationCategory.INTERACTIVE_QUERY, false);

        assertThat(registry.find("docassist.admission.cancelled").tag("state", "active").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("docassist.admission.cancelled").tag("state", "queued").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    void shouldCountVerdictsByActionAndReason() {
        metrics.recordVerdict(ClassificationVerdict.skip(ClassificationVerdict.DENYLIST));

        Counter counter = registry.find("docassist.classification.verdict")
                .tag("action", "skip")
                .tag("reason", "denylist")
                .counter();

        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(1.0);
    }

    @Test
    void shouldCountCapabilityFailures() {
        metrics.incrementCapabilityFailure(TaskType.PAGE_SUMMARY, "llama3.2:3b", "timeout");

        Counter counter = registry.find("docassist.capability.failure")
                .tag("task", "page_summary")
                .tag("capability", "llama3.2:3b")
                .tag("reason", "timeout")
                .counter();

        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(1.0);
    }

    @Test
    void shouldCountExhaustion() {
        metrics.incrementExhausted(TaskType.WORD_LOOKUP);

        assertThat(registry.find("docassist.capability.exhausted").tag("task", "word_lookup").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldRecordLatencyByTaskAndStatus() {
        long durationNanos = TimeUnit.MILLISECONDS.toNanos(120);

        metrics.recordProcessing(TaskType.QUESTION_ANSWER, ProcessingOutcome.Status.PROCESSED, durationNanos);

        Timer timer = registry.find("docassist.capability.latency")
                .tag("task", "question_answer")
                .tag("status", "processed")
                .timer();

        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.NANOSECONDS)).isEqualTo(durationNanos);
    }
}
