package com.phillippitts.docassist.config;

import com.phillippitts.docassist.domain.OperationCategory;
import com.phillippitts.docassist.service.admission.AdmissionController;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for admission and thread pool metrics exposure via Micrometer.
 *
 * <p>Exposes:
 * <ul>
 *   <li>docassist.admission.active{category} - operations currently running</li>
 *   <li>docassist.admission.queue{category} - operations waiting for a slot</li>
 *   <li>docassist.admission.ceiling{category} - configured ceiling</li>
 *   <li>admission.pool.size / active / queued / completed - admission executor state</li>
 * </ul>
 *
 * <p>These metrics are available via:
 * <ul>
 *   <li>HTTP: {@code GET /actuator/metrics/docassist.admission.active}</li>
 *   <li>Prometheus: {@code docassist_admission_active}</li>
 * </ul>
 *
 * <p>Additionally logs a health summary every 5 minutes for operational visibility.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> admissionExecutorProvider;
    private final ObjectProvider<AdmissionController> admissionProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("admissionExecutor") ObjectProvider<ThreadPoolTaskExecutor> admissionExecutorProvider,
            ObjectProvider<AdmissionController> admissionProvider) {
        this.admissionExecutorProvider = admissionExecutorProvider;
        this.admissionProvider = admissionProvider;
    }

    /**
     * Binds per-category admission gauges to the Micrometer registry.
     *
     * @return MeterBinder that registers custom metrics
     */
    @Bean
    public MeterBinder admissionMetrics() {
        return registry -> {
            AdmissionController admission = admissionProvider.getObject();
            for (OperationCategory category : OperationCategory.values()) {
                Gauge.builder("docassist.admission.active", admission, a -> a.getActiveCount(category))
                        .description("Operations currently running")
                        .tag("category", category.id())
                        .register(registry);

                Gauge.builder("docassist.admission.queue", admission, a -> a.getQueueLength(category))
                        .description("Operations waiting for a free slot")
                        .tag("category", category.id())
                        .register(registry);

                Gauge.builder("docassist.admission.ceiling", admission, a -> a.getCeiling(category))
                        .description("Configured concurrency ceiling")
                        .tag("category", category.id())
                        .register(registry);
            }
            LOG.info("Admission metrics registered: docassist.admission.* available via /actuator/metrics");
        };
    }

    /**
     * Binds admission executor thread pool metrics to the Micrometer registry.
     *
     * @return MeterBinder that registers custom metrics
     */
    @Bean
    public MeterBinder admissionExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = admissionExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("admission.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the admission pool")
                    .register(registry);

            Gauge.builder("admission.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads actively executing admitted work")
                    .register(registry);

            Gauge.builder("admission.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of admitted tasks waiting for a thread")
                    .register(registry);

            Gauge.builder("admission.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed admitted tasks")
                    .register(registry);
        };
    }

    /**
     * Logs admission health every 5 minutes for operational monitoring.
     */
    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logAdmissionHealth() {
        ThreadPoolExecutor executor = admissionExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Admission Health: {}, pool size={}/{}, active threads={}",
                admissionProvider.getObject().getStatus(),
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount());
    }
}
