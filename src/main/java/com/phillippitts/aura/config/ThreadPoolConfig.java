package com.phillippitts.aura.config;

import com.phillippitts.aura.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool for the Evidence phase.
 *
 * <p>Pool sizes come from {@link ThreadPoolProperties} ({@code threadpool.evidence.*}).
 */
@Configuration
public class ThreadPoolConfig {

    public static final String EVIDENCE_EXECUTOR = "evidenceExecutor";

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Bounded executor for evidence branches.
     *
     * <p>With the default queue capacity of 0 the pool adds a thread for every branch up to the
     * max size instead of parking branches behind other runs' blocking calls. Beyond that the
     * submission is rejected ({@link ThreadPoolExecutor.AbortPolicy}) and the evidence phase
     * degrades that branch to an empty result; the pipeline thread never runs a branch inline.
     *
     * <p>Log4j2 ThreadContext is copied from the submitting thread so evidence logs carry the
     * run id of the run that launched them.
     *
     * @return executor for evidence branches
     */
    @Bean(name = EVIDENCE_EXECUTOR)
    public Executor evidenceExecutor() {
        ThreadPoolProperties.EvidencePoolProperties props = threadPoolProperties.getEvidence();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(props.getAwaitTerminationSeconds());
        executor.setTaskDecorator(threadContextDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the submitter's ThreadContext onto the worker and restores the worker's own
     * context afterwards.
     */
    static TaskDecorator threadContextDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    ThreadContext.clearMap();
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearMap();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
