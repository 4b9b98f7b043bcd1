package com.phillippitts.docassist.service.orchestration;

import com.phillippitts.docassist.domain.ExtractedContent;
import com.phillippitts.docassist.domain.ProcessingOutcome;
import com.phillippitts.docassist.domain.Trigger;

import java.util.concurrent.CompletableFuture;

/**
 * Runs content requests through the classification gate, the admission controller and the
 * fallback executor.
 *
 * <p><b>Pipeline:</b>
 * <ol>
 *   <li>Gate: content requests are classified against the current policy. A verdict other
 *       than automatic ends the request with a skipped, prompt or waiting outcome.</li>
 *   <li>Admission: the work is submitted under the request's category with the source as
 *       resource key, so one source is never processed twice at once.</li>
 *   <li>Fallback: the model call is tried against each ranked capability until one
 *       succeeds.</li>
 * </ol>
 *
 * <p><b>Error Handling:</b> Classification outcomes are values. The returned future fails
 * only with {@link com.phillippitts.docassist.exception.OperationCancelledException},
 * {@link com.phillippitts.docassist.exception.CapabilityUnavailableException} or
 * {@link com.phillippitts.docassist.exception.CandidatesExhaustedException}.
 *
 * @see com.phillippitts.docassist.service.admission.AdmissionController
 * @see com.phillippitts.docassist.service.classification.ClassificationGate
 * @see com.phillippitts.docassist.service.capability.FallbackExecutor
 */
public interface ContentProcessingOrchestrator {

    /**
     * Summarises a document into key points. Results are cached per source for one hour.
     *
     * @param force bypass the gate's automatic checks and the cached result
     */
    CompletableFuture<ProcessingOutcome> summarize(ExtractedContent content, Trigger trigger, boolean force);

    /**
     * Extracts key points from a document and stores them in the content index.
     */
    CompletableFuture<ProcessingOutcome> index(ExtractedContent content, Trigger trigger, boolean force);

    /**
     * Answers a question about a source. Not gated: the user asked explicitly.
     *
     * @param context document text; when blank, the indexed text for the source is used if any
     */
    CompletableFuture<ProcessingOutcome> answer(String source, String question, String context);

    /**
     * Gives a short definition of a term. Not gated.
     */
    CompletableFuture<ProcessingOutcome> lookup(String term);
}
