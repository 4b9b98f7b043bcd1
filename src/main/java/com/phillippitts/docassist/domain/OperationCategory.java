package com.phillippitts.docassist.domain;

/**
 * Class of work admitted by the {@link com.phillippitts.docassist.service.admission.AdmissionController}.
 *
 * <p>Each category has its own concurrency ceiling. Summarization is the heaviest per call,
 * so its default ceiling is the tightest.
 */
public enum OperationCategory {

    INTERACTIVE_QUERY("interactive-query", 3),
    CONTENT_INDEXING("content-indexing", 3),
    CONTENT_SUMMARIZATION("content-summarization", 2);

    private final String id;
    private final int defaultCeiling;

    OperationCategory(String id, int defaultCeiling) {
        this.id = id;
        this.defaultCeiling = defaultCeiling;
    }

    /** Stable identifier used in logs, metrics tags and URLs. */
    public String id() {
        return id;
    }

    public int defaultCeiling() {
        return defaultCeiling;
    }

    /**
     * Resolves a category from its identifier or enum name (case-insensitive).
     *
     * @throws IllegalArgumentException if no category matches
     */
    public static OperationCategory fromId(String value) {
        if (value != null) {
            for (OperationCategory c : values()) {
                if (c.id.equalsIgnoreCase(value) || c.name().equalsIgnoreCase(value)) {
                    return c;
                }
            }
        }
        throw new IllegalArgumentException("Unknown operation category: " + value);
    }
}
