package com.phillippitts.docassist.exception;

import com.phillippitts.docassist.domain.OperationCategory;

/**
 * Raised to a caller whose queued or active operation was explicitly cancelled.
 */
public class OperationCancelledException extends DocAssistException {

    private final OperationCategory category;
    private final String resourceKey;

    public OperationCancelledException(OperationCategory category, String resourceKey, String message) {
        super(message + " (category=" + (category == null ? "unknown" : category.id()) + ")");
        this.category = category;
        this.resourceKey = resourceKey;
    }

    /** Used by work that observed its cancellation token. */
    public OperationCancelledException(String message) {
        super(message);
        this.category = null;
        this.resourceKey = null;
    }

    public OperationCategory getCategory() {
        return category;
    }

    public String getResourceKey() {
        return resourceKey;
    }
}
