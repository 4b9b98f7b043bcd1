package com.phillippitts.docassist.presentation.controller;

import com.phillippitts.docassist.domain.ClassificationSignals;
import com.phillippitts.docassist.domain.ExtractedContent;
import com.phillippitts.docassist.domain.ProcessingOutcome;
import com.phillippitts.docassist.domain.Trigger;
import com.phillippitts.docassist.service.orchestration.ContentProcessingOrchestrator;
import com.phillippitts.docassist.util.LogSanitizer;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;

/**
 * Content processing endpoints. Each request is answered asynchronously once the admission
 * controller has run it; skips, prompts and waits come back as 200 with the reason code.
 */
@RestController
@RequestMapping("/api")
class ProcessingController {

    private static final Logger LOG = LogManager.getLogger(ProcessingController.class);

    private final ContentProcessingOrchestrator orchestrator;

    ProcessingController(ContentProcessingOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/summaries")
    CompletableFuture<ProcessingOutcome> summarize(@Valid @RequestBody ContentRequest request) {
        LOG.info("Summary requested for {} (trigger={}, force={})",
                LogSanitizer.source(request.source(), 80), request.triggerOrDefault(), request.force());
        return orchestrator.summarize(request.toContent(), request.triggerOrDefault(), request.force());
    }

    @PostMapping("/index")
    CompletableFuture<ProcessingOutcome> index(@Valid @RequestBody ContentRequest request) {
        LOG.info("Indexing requested for {}", LogSanitizer.source(request.source(), 80));
        return orchestrator.index(request.toContent(), request.triggerOrDefault(), request.force());
    }

    @PostMapping("/questions")
    CompletableFuture<ProcessingOutcome> answer(@Valid @RequestBody QuestionRequest request) {
        LOG.info("Question about {}", LogSanitizer.source(request.source(), 80));
        return orchestrator.answer(request.source(), request.question(), request.context());
    }

    @PostMapping("/lookups")
    CompletableFuture<ProcessingOutcome> lookup(@Valid @RequestBody LookupRequest request) {
        return orchestrator.lookup(request.term());
    }

    /**
     * Extracted document as sent by the signal extractor.
     */
    record ContentRequest(
            @NotBlank String source,
            String contentType,
            String title,
            String text,
            @PositiveOrZero int wordCount,
            ClassificationSignals signals,
            Trigger trigger,
            boolean force
    ) {
        Trigger triggerOrDefault() {
            return trigger == null ? Trigger.MANUAL : trigger;
        }

        ExtractedContent toContent() {
            return new ExtractedContent(source, contentType, title, text, wordCount, signals);
        }
    }

    record QuestionRequest(@NotBlank String source, @NotBlank String question, String context) {}

    record LookupRequest(@NotBlank String term) {}
}
