package com.phillippitts.docassist.exception;

import com.phillippitts.docassist.domain.TaskType;

/**
 * Thrown when no inference capability is reachable at all, before any attempt is made.
 */
public class CapabilityUnavailableException extends DocAssistException {

    private final TaskType taskType;

    public CapabilityUnavailableException(TaskType taskType) {
        super("No capabilities available for task " + taskType);
        this.taskType = taskType;
    }

    public TaskType getTaskType() {
        return taskType;
    }
}
