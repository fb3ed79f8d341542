package com.phillippitts.adaptiveencoder.config;

import com.phillippitts.adaptiveencoder.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors for progress monitoring and batch processing.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} ({@code threadpool.*}).
 * Both executors copy the Log4j2 ThreadContext of the submitting thread into the worker so that
 * monitor and batch log lines keep their {@code runId}/{@code requestId}.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor running one progress-monitor task per active encoder pass.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. A monitor that cannot be
     * queued runs on the orchestrating thread, which is waiting on it anyway.
     *
     * @return executor for progress monitors
     */
    @Bean(name = "progressExecutor")
    public Executor progressExecutor() {
        return buildExecutor(threadPoolProperties.getMonitor(), 30, new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * Executor for the per-file runs of a batch.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. Files that do not fit in the queue
     * are reported as failed batch items rather than run on the request thread.
     *
     * @return executor for batch runs
     */
    @Bean(name = "batchExecutor")
    public Executor batchExecutor() {
        // Saturation is reported per file by the batch service.
        return buildExecutor(threadPoolProperties.getBatch(), 0, new ThreadPoolExecutor.AbortPolicy());
    }

    private static ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties props,
                                                        int awaitTerminationSeconds,
                                                        RejectedExecutionHandler rejectionPolicy) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejectionPolicy);
        executor.setWaitForTasksToCompleteOnShutdown(awaitTerminationSeconds > 0);
        executor.setAwaitTerminationSeconds(awaitTerminationSeconds);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the submitter's ThreadContext into the worker and restores the worker's own
     * context afterwards.
     */
    static TaskDecorator mdcPropagatingDecorator() {
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
