package com.phillippitts.docassist.exception;

import com.phillippitts.docassist.domain.TaskType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown when every ranked candidate capability failed for a task.
 *
 * <p>Carries the attempt count and the failure message recorded for each candidate, in
 * the order they were tried. The last candidate's exception is attached as the cause.
 */
public class CandidatesExhaustedException extends DocAssistException {

    private final TaskType taskType;
    private final int attempts;
    private final Map<String, String> failures;

    public CandidatesExhaustedException(TaskType taskType, Map<String, String> failures, Throwable lastFailure) {
        super("all " + failures.size() + " candidates failed for task " + taskType, lastFailure);
        this.taskType = taskType;
        this.attempts = failures.size();
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public TaskType getTaskType() {
        return taskType;
    }

    public int getAttempts() {
        return attempts;
    }

    /** Candidate id to failure message, in attempt order. */
    public Map<String, String> getFailures() {
        return failures;
    }
}
