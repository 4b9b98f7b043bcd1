package com.phillippitts.docassist.service.capability.event;

import com.phillippitts.docassist.domain.TaskType;

import java.time.Instant;

/** Published when one candidate fails and the next one is attempted. */
public record CapabilityFailedEvent(TaskType taskType, String capability, String reason, boolean timeout, Instant at) { }
