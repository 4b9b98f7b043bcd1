package com.phillippitts.docassist.service.events;

import com.phillippitts.docassist.service.admission.event.OperationCancelledEvent;
import com.phillippitts.docassist.service.admission.event.OperationQueuedEvent;
import com.phillippitts.docassist.service.capability.event.AllCapabilitiesFailedEvent;
import com.phillippitts.docassist.service.capability.event.CapabilityFailedEvent;
import com.phillippitts.docassist.service.metrics.ProcessingMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Observer for admission and capability events. Every event is counted; operator-facing
 * warnings are throttled to avoid log spam.
 */
@Component
class ProcessingEventsListener {
    private static final Logger LOG = LogManager.getLogger(ProcessingEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final ProcessingMetrics metrics;

    ProcessingEventsListener(ProcessingMetrics metrics) {
        this.metrics = metrics;
    }

    @EventListener
    void onQueued(OperationQueuedEvent e) {
        metrics.incrementQueued(e.category());
        if (shouldLog("queued-" + e.category().id())) {
            LOG.info("{} operations are queuing (queue={}). Raise admission.* ceilings if this persists.",
                    e.category().id(), e.queueLength());
        }
    }

    @EventListener
    void onCancelled(OperationCancelledEvent e) {
        metrics.incrementCancelled(e.category(), e.wasActive());
    }

    @EventListener
    void onCapabilityFailed(CapabilityFailedEvent e) {
        metrics.incrementCapabilityFailure(e.taskType(), e.capability(), e.reason());
        if (e.timeout() && shouldLog("timeout-" + e.capability())) {
            LOG.warn("Capability {} timed out for {}. Check model server load or capability.* timeouts.",
                    e.capability(), e.taskType());
        }
    }

    @EventListener
    void onAllCapabilitiesFailed(AllCapabilitiesFailedEvent e) {
        metrics.incrementExhausted(e.taskType());
        if (shouldLog("exhausted-" + e.taskType())) {
            LOG.warn("No capability could serve {} ({} attempted). Is the model server running?",
                    e.taskType(), e.attempts());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
