package com.phillippitts.docassist.service.orchestration;

import com.phillippitts.docassist.domain.ClassificationVerdict;
import com.phillippitts.docassist.domain.ExtractedContent;
import com.phillippitts.docassist.domain.OperationCategory;
import com.phillippitts.docassist.domain.ProcessingOutcome;
import com.phillippitts.docassist.domain.TaskType;
import com.phillippitts.docassist.domain.Trigger;
import com.phillippitts.docassist.service.admission.AdmissionController;
import com.phillippitts.docassist.service.admission.CancellationToken;
import com.phillippitts.docassist.service.cache.ResultCache;
import com.phillippitts.docassist.service.capability.FallbackExecutor;
import com.phillippitts.docassist.service.capability.InferenceClient;
import com.phillippitts.docassist.service.classification.ClassificationGate;
import com.phillippitts.docassist.service.index.ContentIndex;
import com.phillippitts.docassist.service.index.IndexedContent;
import com.phillippitts.docassist.service.metrics.ProcessingMetrics;
import com.phillippitts.docassist.service.policy.PolicyStore;
import com.phillippitts.docassist.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Default implementation of {@link ContentProcessingOrchestrator}.
 *
 * <p>Work submitted to the admission controller checks its cancellation token before the
 * model call and again before publishing results, so a cancelled summary never reaches the
 * cache or the index.
 */
public class DefaultContentProcessingOrchestrator implements ContentProcessingOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultContentProcessingOrchestrator.class);

    static final Duration SUMMARY_TTL = Duration.ofHours(1);
    private static final int SOURCE_PREVIEW = 80;
    private static final String LOOKUP_KEY_PREFIX = "lookup:";

    private final ClassificationGate gate;
    private final PolicyStore policyStore;
    private final AdmissionController admission;
    private final FallbackExecutor fallback;
    private final InferenceClient client;
    private final ResultCache<ProcessingOutcome> summaryCache;
    private final ContentIndex contentIndex;
    private final ProcessingMetrics metrics;
    private final Clock clock;

    /**
     * Constructs the orchestrator.
     *
     * @throws NullPointerException if any parameter is null
     */
    public DefaultContentProcessingOrchestrator(ClassificationGate gate,
                                                PolicyStore policyStore,
                                                AdmissionController admission,
                                                FallbackExecutor fallback,
                                                InferenceClient client,
                                                ResultCache<ProcessingOutcome> summaryCache,
                                                ContentIndex contentIndex,
                                                ProcessingMetrics metrics,
                                                Clock clock) {
        this.gate = Objects.requireNonNull(gate, "gate must not be null");
        this.policyStore = Objects.requireNonNull(policyStore, "policyStore must not be null");
        this.admission = Objects.requireNonNull(admission, "admission must not be null");
        this.fallback = Objects.requireNonNull(fallback, "fallback must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.summaryCache = Objects.requireNonNull(summaryCache, "summaryCache must not be null");
        this.contentIndex = Objects.requireNonNull(contentIndex, "contentIndex must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public CompletableFuture<ProcessingOutcome> summarize(ExtractedContent content, Trigger trigger, boolean force) {
        Objects.requireNonNull(content, "content must not be null");
        ClassificationVerdict verdict = classify(content, trigger, force);
        if (!verdict.proceeds()) {
            return CompletableFuture.completedFuture(ProcessingOutcome.notProcessed(verdict));
        }

        long start = System.nanoTime();
        if (!force) {
            ProcessingOutcome cached = summaryCache.get(content.source()).orElse(null);
            if (cached != null) {
                LOG.debug("Summary cache hit for {}", preview(content.source()));
                ProcessingOutcome outcome = cached.asCached(elapsedMs(start));
                metrics.recordProcessing(TaskType.PAGE_SUMMARY, outcome.status(), System.nanoTime() - start);
                return CompletableFuture.completedFuture(outcome);
            }
        }

        return admission.submit(OperationCategory.CONTENT_SUMMARIZATION, content.source(), token -> {
            String request = Prompts.summaryRequest(content);
            Completion completion = complete(TaskType.PAGE_SUMMARY, Prompts.SUMMARY_SYSTEM, request, token);
            ProcessingOutcome outcome = ProcessingOutcome.processed(completion.capability(), completion.text(),
                    KeyPointExtractor.extractOrPlaceholder(completion.text()), elapsedMs(start));
            summaryCache.put(content.source(), outcome, SUMMARY_TTL);
            finished(TaskType.PAGE_SUMMARY, outcome, start);
            return outcome;
        });
    }

    @Override
    public CompletableFuture<ProcessingOutcome> index(ExtractedContent content, Trigger trigger, boolean force) {
        Objects.requireNonNull(content, "content must not be null");
        ClassificationVerdict verdict = classify(content, trigger, force);
        if (!verdict.proceeds()) {
            return CompletableFuture.completedFuture(ProcessingOutcome.notProcessed(verdict));
        }

        long start = System.nanoTime();
        return admission.submit(OperationCategory.CONTENT_INDEXING, content.source(), token -> {
            String request = Prompts.indexRequest(content);
            Completion completion = complete(TaskType.PAGE_SUMMARY, Prompts.INDEX_SYSTEM, request, token);
            List<String> keyPoints = KeyPointExtractor.extract(completion.text());
            contentIndex.put(new IndexedContent(content.source(), content.title(), keyPoints,
                    content.text(), clock.instant()));
            ProcessingOutcome outcome = ProcessingOutcome.processed(completion.capability(), completion.text(),
                    keyPoints, elapsedMs(start));
            finished(TaskType.PAGE_SUMMARY, outcome, start);
            return outcome;
        });
    }

    @Override
    public CompletableFuture<ProcessingOutcome> answer(String source, String question, String context) {
        Objects.requireNonNull(source, "source must not be null");
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("Question must not be blank");
        }
        String documentText = context;
        if (documentText == null || documentText.isBlank()) {
            documentText = contentIndex.get(source).map(IndexedContent::text).orElse("");
        }
        String system = Prompts.answerSystem(documentText);

        long start = System.nanoTime();
        return admission.submit(OperationCategory.INTERACTIVE_QUERY, source, token -> {
            Completion completion = complete(TaskType.QUESTION_ANSWER, system, question.trim(), token);
            ProcessingOutcome outcome = ProcessingOutcome.processed(completion.capability(), completion.text(),
                    List.of(), elapsedMs(start));
            finished(TaskType.QUESTION_ANSWER, outcome, start);
            return outcome;
        });
    }

    @Override
    public CompletableFuture<ProcessingOutcome> lookup(String term) {
        if (term == null || term.isBlank()) {
            throw new IllegalArgumentException("Term must not be blank");
        }
        String normalized = term.trim();
        String key = LOOKUP_KEY_PREFIX + normalized.toLowerCase(Locale.ROOT);

        long start = System.nanoTime();
        return admission.submit(OperationCategory.INTERACTIVE_QUERY, key, token -> {
            Completion completion = complete(TaskType.WORD_LOOKUP, Prompts.LOOKUP_SYSTEM,
                    Prompts.lookupRequest(normalized), token);
            ProcessingOutcome outcome = ProcessingOutcome.processed(completion.capability(), completion.text(),
                    List.of(), elapsedMs(start));
            finished(TaskType.WORD_LOOKUP, outcome, start);
            return outcome;
        });
    }

    private ClassificationVerdict classify(ExtractedContent content, Trigger trigger, boolean force) {
        ClassificationVerdict verdict = gate.classify(content, policyStore.load(), trigger, force);
        metrics.recordVerdict(verdict);
        if (!verdict.proceeds()) {
            LOG.info("Not processing {}: action={}, reason={}",
                    preview(content.source()), verdict.action(), verdict.reason());
        }
        return verdict;
    }

    private Completion complete(TaskType taskType, String system, String user, CancellationToken token) {
        token.throwIfCancelled();
        int payload = system.length() + user.length();
        Duration timeout = fallback.timeoutFor(payload);
        Completion completion = fallback.tryWithFallback(taskType, payload,
                capability -> new Completion(capability, client.complete(capability, system, user, timeout, token)));
        token.throwIfCancelled();
        return completion;
    }

    private void finished(TaskType taskType, ProcessingOutcome outcome, long start) {
        metrics.recordProcessing(taskType, outcome.status(), System.nanoTime() - start);
        LOG.info("{} completed with {} in {} ms", taskType, outcome.capability(), outcome.durationMs());
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    private static String preview(String source) {
        return LogSanitizer.source(source, SOURCE_PREVIEW);
    }

    private record Completion(String capability, String text) {}
}
