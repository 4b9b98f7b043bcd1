package com.phillippitts.docassist.exception;

import com.phillippitts.docassist.domain.OperationCategory;
import com.phillippitts.docassist.domain.TaskType;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void docAssistExceptionShouldIncludeCause() {
        IOException cause = new IOException("IO failure");
        DocAssistException ex = new DocAssistException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void allDomainExceptionsShareBaseType() {
        assertThat(new CapabilityUnavailableException(TaskType.PAGE_SUMMARY)).isInstanceOf(DocAssistException.class);
        assertThat(new CapabilityInvocationException("x", "m")).isInstanceOf(DocAssistException.class);
        assertThat(new OperationCancelledException("x")).isInstanceOf(DocAssistException.class);
        assertThat(new CandidatesExhaustedException(TaskType.WORD_LOOKUP, Map.of(), null))
                .isInstanceOf(DocAssistException.class);
    }

    @Test
    void invocationExceptionNamesCapability() {
        CapabilityInvocationException ex = new CapabilityInvocationException("request failed", "llama3.2:3b");

        assertThat(ex.getMessage()).contains("llama3.2:3b");
        assertThat(ex.getCapability()).isEqualTo("llama3.2:3b");
        assertThat(ex.isTimeout()).isFalse();
    }

    @Test
    void timeoutFactoryMarksTimeout() {
        CapabilityInvocationException ex = CapabilityInvocationException.timeout("m1", 1500, null);

        assertThat(ex.isTimeout()).isTrue();
        assertThat(ex.getMessage()).contains("1500ms");
    }

    @Test
    void exhaustionKeepsAttemptOrderAndLastCause() {
        Map<String, String> failures = new LinkedHashMap<>();
        failures.put("a", "timeout");
        failures.put("b", "refused");
        IllegalStateException last = new IllegalStateException("refused");

        CandidatesExhaustedException ex = new CandidatesExhaustedException(TaskType.QUESTION_ANSWER, failures, last);

        assertThat(ex.getAttempts()).isEqualTo(2);
        assertThat(ex.getFailures()).containsExactly(Map.entry("a", "timeout"), Map.entry("b", "refused"));
        assertThat(ex.getCause()).isSameAs(last);
        assertThat(ex.getMessage()).contains("QUESTION_ANSWER");
    }

    @Test
    void cancellationCarriesCategoryAndKey() {
        OperationCancelledException ex = new OperationCancelledException(
                OperationCategory.CONTENT_SUMMARIZATION, "doc-1", "Operation cancelled");

        assertThat(ex.getCategory()).isEqualTo(OperationCategory.CONTENT_SUMMARIZATION);
        assertThat(ex.getResourceKey()).isEqualTo("doc-1");
        assertThat(ex.getMessage()).contains("content-summarization");
    }
}
