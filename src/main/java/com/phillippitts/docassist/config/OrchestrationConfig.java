package com.phillippitts.docassist.config;

import com.phillippitts.docassist.domain.ProcessingOutcome;
import com.phillippitts.docassist.service.admission.AdmissionController;
import com.phillippitts.docassist.service.cache.InMemoryResultCache;
import com.phillippitts.docassist.service.cache.ResultCache;
import com.phillippitts.docassist.service.capability.FallbackExecutor;
import com.phillippitts.docassist.service.capability.InferenceClient;
import com.phillippitts.docassist.service.classification.ClassificationGate;
import com.phillippitts.docassist.service.index.ContentIndex;
import com.phillippitts.docassist.service.index.InMemoryContentIndex;
import com.phillippitts.docassist.service.metrics.ProcessingMetrics;
import com.phillippitts.docassist.service.orchestration.ContentProcessingOrchestrator;
import com.phillippitts.docassist.service.orchestration.DefaultContentProcessingOrchestrator;
import com.phillippitts.docassist.service.policy.PolicyStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the content processing orchestrator and its stores explicitly.
 */
@Configuration
public class OrchestrationConfig {

    @Bean
    public ResultCache<ProcessingOutcome> summaryCache(Clock clock) {
        return new InMemoryResultCache<>(clock);
    }

    @Bean
    public ContentIndex contentIndex() {
        return new InMemoryContentIndex();
    }

    @Bean
    public ContentProcessingOrchestrator contentProcessingOrchestrator(ClassificationGate gate,
                                                                      PolicyStore policyStore,
                                                                      AdmissionController admission,
                                                                      FallbackExecutor fallback,
                                                                      InferenceClient client,
                                                                      ResultCache<ProcessingOutcome> summaryCache,
                                                                      ContentIndex contentIndex,
                                                                      ProcessingMetrics metrics,
                                                                      Clock clock) {
        return new DefaultContentProcessingOrchestrator(gate, policyStore, admission, fallback, client,
                summaryCache, contentIndex, metrics, clock);
    }
}
