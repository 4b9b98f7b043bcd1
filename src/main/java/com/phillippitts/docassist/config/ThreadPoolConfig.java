package com.phillippitts.docassist.config;

import com.phillippitts.docassist.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for thread pools used in asynchronous processing.
 * Provides executors for admitted work and for individually timed capability calls.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on hardware and workload.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the thread pool that runs work admitted by the admission controller.
     *
     * <p>Pool sizing strategy configured via {@code threadpool.admission.*} properties:
     * <ul>
     *   <li>Core pool: default 8 - covers the sum of the default category ceilings</li>
     *   <li>Max pool: default 16 - handles raised ceilings</li>
     *   <li>Queue: default 50 tasks - prevents unbounded memory growth</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. The admission controller
     * already bounds concurrency; a rejection fails that one operation and frees its slot.
     * Running admitted work on the submitting thread would block the caller instead.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext (MDC) from the submitting thread to
     * the worker thread to preserve request correlation IDs in async logs.
     *
     * @return Configured executor for admitted work
     */
    @Bean(name = "admissionExecutor")
    public ThreadPoolTaskExecutor admissionExecutor() {
        return build(threadPoolProperties.getAdmission(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Creates the thread pool for timed capability calls.
     *
     * <p>Pool sizing strategy configured via {@code threadpool.capability.*} properties
     * (default 4 core, 8 max, queue 50).
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}
     * When the pool and queue are full, the calling thread makes the call itself,
     * providing backpressure instead of failing the candidate.
     *
     * @return Configured executor for capability calls
     */
    @Bean(name = "capabilityExecutor")
    public ThreadPoolTaskExecutor capabilityExecutor() {
        return build(threadPoolProperties.getCapability(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    private static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props,
                                                RejectedExecutionHandler rejection) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejection);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagation());
        executor.initialize();
        return executor;
    }

    // Package-private for tests
    static TaskDecorator mdcPropagation() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
