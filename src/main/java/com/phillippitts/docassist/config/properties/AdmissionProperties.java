package com.phillippitts.docassist.config.properties;

import com.phillippitts.docassist.domain.OperationCategory;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Per-category concurrency ceilings for the admission controller.
 *
 * <p>Properties:
 * <ul>
 *   <li>admission.interactive-query-max - parallel interactive queries (default: 3)</li>
 *   <li>admission.content-indexing-max - parallel indexing operations (default: 3)</li>
 *   <li>admission.content-summarization-max - parallel summaries (default: 2)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "admission")
@Validated
public class AdmissionProperties {

    @Positive(message = "Interactive query ceiling must be positive")
    private int interactiveQueryMax = OperationCategory.INTERACTIVE_QUERY.defaultCeiling();

    @Positive(message = "Content indexing ceiling must be positive")
    private int contentIndexingMax = OperationCategory.CONTENT_INDEXING.defaultCeiling();

    @Positive(message = "Content summarization ceiling must be positive")
    private int contentSummarizationMax = OperationCategory.CONTENT_SUMMARIZATION.defaultCeiling();

    public int ceilingFor(OperationCategory category) {
        return switch (category) {
            case INTERACTIVE_QUERY -> interactiveQueryMax;
            case CONTENT_INDEXING -> contentIndexingMax;
            case CONTENT_SUMMARIZATION -> contentSummarizationMax;
        };
    }

    public int getInteractiveQueryMax() {
        return interactiveQueryMax;
    }

    public void setInteractiveQueryMax(int interactiveQueryMax) {
        this.interactiveQueryMax = interactiveQueryMax;
    }

    public int getContentIndexingMax() {
        return contentIndexingMax;
    }

    public void setContentIndexingMax(int contentIndexingMax) {
        this.contentIndexingMax = contentIndexingMax;
    }

    public int getContentSummarizationMax() {
        return contentSummarizationMax;
    }

    public void setContentSummarizationMax(int contentSummarizationMax) {
        this.contentSummarizationMax = contentSummarizationMax;
    }
}
