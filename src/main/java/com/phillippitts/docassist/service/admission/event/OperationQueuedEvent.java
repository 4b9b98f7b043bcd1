package com.phillippitts.docassist.service.admission.event;

import com.phillippitts.docassist.domain.OperationCategory;

import java.time.Instant;

/** Published when submitted work is queued because its category is at its ceiling. */
public record OperationQueuedEvent(OperationCategory category, String resourceKey, int queueLength, Instant at) { }
