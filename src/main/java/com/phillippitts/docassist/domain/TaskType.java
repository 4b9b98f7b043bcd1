package com.phillippitts.docassist.domain;

/**
 * Kind of inference task, used to rank capabilities for a request.
 *
 * <p>Short-latency tasks prefer small models; long-context tasks prefer larger ones.
 */
public enum TaskType {
    WORD_LOOKUP,
    PAGE_SUMMARY,
    EMAIL_SUMMARY,
    QUESTION_ANSWER
}
