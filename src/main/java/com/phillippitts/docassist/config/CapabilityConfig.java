package com.phillippitts.docassist.config;

import com.phillippitts.docassist.config.properties.CapabilityProperties;
import com.phillippitts.docassist.config.properties.ClassificationProperties;
import com.phillippitts.docassist.service.capability.CachingCapabilityProbe;
import com.phillippitts.docassist.service.capability.modelserver.ModelServerClient;
import com.phillippitts.docassist.service.policy.InMemoryPolicyStore;
import com.phillippitts.docassist.service.policy.PolicyStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the model-server backend, the availability probe and the policy store.
 */
@Configuration
public class CapabilityConfig {

    private static final Logger LOG = LogManager.getLogger(CapabilityConfig.class);

    private final CapabilityProperties capabilityProperties;

    public CapabilityConfig(CapabilityProperties capabilityProperties) {
        this.capabilityProperties = capabilityProperties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public HttpClient modelServerHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(capabilityProperties.getProbeTimeoutMs()))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    @Bean
    public ModelServerClient modelServerClient(HttpClient modelServerHttpClient) {
        LOG.info("Model server at {}", capabilityProperties.getBaseUrl());
        return new ModelServerClient(modelServerHttpClient, capabilityProperties.getBaseUrl(),
                Duration.ofMillis(capabilityProperties.getProbeTimeoutMs()));
    }

    /**
     * Installed models, re-probed at most once per {@code capability.probe-ttl-ms}.
     */
    @Bean
    public CachingCapabilityProbe capabilityProbe(ModelServerClient modelServerClient, Clock clock) {
        return new CachingCapabilityProbe(modelServerClient::listModels,
                Duration.ofMillis(capabilityProperties.getProbeTtlMs()), clock);
    }

    /**
     * Policy store seeded from {@code classification.*}; the pin from {@code capability.pinned}.
     */
    @Bean
    public PolicyStore policyStore(ClassificationProperties classificationProperties) {
        return new InMemoryPolicyStore(classificationProperties.toPolicy(), capabilityProperties.getPinned());
    }
}
