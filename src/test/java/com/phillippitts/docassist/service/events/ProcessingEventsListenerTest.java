package com.phillippitts.docassist.service.events;

import com.phillippitts.docassist.domain.OperationCategory;
import com.phillippitts.docassist.domain.TaskType;
import com.phillippitts.docassist.service.admission.event.OperationCancelledEvent;
import com.phillippitts.docassist.service.admission.event.OperationQueuedEvent;
import com.phillippitts.docassist.service.capability.event.AllCapabilitiesFailedEvent;
import com.phillippitts.docassist.service.capability.event.CapabilityFailedEvent;
import com.phillippitts.docassist.service.metrics.ProcessingMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ProcessingEventsListenerTest {

    private SimpleMeterRegistry registry;
    private ProcessingEventsListener listener;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        listener = new ProcessingEventsListener(new ProcessingMetrics(registry));
    }

    @Test
    void throttlesRepeatLogs() {
        assertThat(listener.shouldLog("timeout-m1")).isTrue();
        assertThat(listener.shouldLog("timeout-m1")).isFalse();
        assertThat(listener.shouldLog("timeout-m2")).isTrue();
    }

    @Test
    void countsEveryEventEvenWhenLogIsThrottled() {
        listener.onQueued(new OperationQueuedEvent(OperationCategory.CONTENT_INDEXING, "k", 1, Instant.now()));
        listener.onQueued(new OperationQueuedEvent(OperationCategory.CONTENT_INDEXING, "k", 2, Instant.now()));

        assertThat(registry.find("docassist.admission.queued").counter().count()).isEqualTo(2.0);
    }

    @Test
    void recordsCancellationsAndFailures() {
        listener.onCancelled(new OperationCancelledEvent(OperationCategory.INTERACTIVE_QUERY, "k", true, Instant.now()));
        listener.onCapabilityFailed(new CapabilityFailedEvent(TaskType.PAGE_SUMMARY, "m1", "timeout", true, Instant.now()));
        listener.onAllCapabilitiesFailed(new AllCapabilitiesFailedEvent(TaskType.PAGE_SUMMARY, 2, Instant.now()));

        assertThat(registry.find("docassist.admission.cancelled").tag("state", "active").counter()).isNotNull();
        assertThat(registry.find("docassist.capability.failure").tag("capability", "m1").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("docassist.capability.exhausted").tag("task", "page_summary").counter().count())
                .isEqualTo(1.0);
    }
}
