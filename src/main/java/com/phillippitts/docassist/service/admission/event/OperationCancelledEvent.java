package com.phillippitts.docassist.service.admission.event;

import com.phillippitts.docassist.domain.OperationCategory;

import java.time.Instant;

/** Published when an active or queued operation is cancelled. */
public record OperationCancelledEvent(OperationCategory category, String resourceKey, boolean wasActive, Instant at) { }
