package com.phillippitts.docassist.service.capability.event;

import com.phillippitts.docassist.domain.TaskType;

import java.time.Instant;

/** Published when every candidate for a task failed. */
public record AllCapabilitiesFailedEvent(TaskType taskType, int attempts, Instant at) { }
