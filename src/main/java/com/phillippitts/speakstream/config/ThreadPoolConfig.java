package com.phillippitts.speakstream.config;

import com.phillippitts.speakstream.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;

/**
 * Configuration for the shared worker pool that runs per-session work and for the single
 * worker that owns the recognizer.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on hardware and expected connection count.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the pool every session's serial executor delegates to.
     *
     * <p>Pool sizing configured via {@code threadpool.session.*} properties:
     * <ul>
     *   <li>Core pool: default 8</li>
     *   <li>Max pool: default 32</li>
     *   <li>Queue: default 1000 tasks</li>
     * </ul>
     *
     * <p>Rejection policy: {@link #callerRunsUnlessShutdown()}. A saturated pool slows the
     * WebSocket reader thread down instead of dropping audio. Session tasks never wait for the
     * recognizer, so pool threads are only busy with buffering and sending.
     *
     * <p>MDC propagation: copies the Log4j2 ThreadContext (notably {@code sessionId}) from the
     * submitting thread to the worker thread.
     *
     * @return configured executor for session work
     */
    @Bean(name = "sessionExecutor")
    public Executor sessionExecutor() {
        ThreadPoolProperties.SessionPoolProperties props = threadPoolProperties.getSession();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(callerRunsUnlessShutdown());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(threadContextPropagator());
        executor.initialize();
        return executor;
    }

    /**
     * Creates the single worker that runs every recognizer call in submission order.
     *
     * <p>Dispatches from all sessions queue here instead of holding session pool threads
     * while the recognizer is busy. The queue is unbounded; a rejected task after shutdown
     * surfaces as {@link RejectedExecutionException}.
     *
     * @return single-thread executor for recognition
     */
    @Bean(name = "recognitionExecutor")
    @Profile("!client")
    public Executor recognitionExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("recognizer-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(threadContextPropagator());
        executor.initialize();
        return executor;
    }

    /**
     * Runs the task on the submitting thread while the pool is alive and rejects it once the
     * pool is shut down, so callers always learn that a task was not run.
     */
    static RejectedExecutionHandler callerRunsUnlessShutdown() {
        return (runnable, pool) -> {
            if (pool.isShutdown()) {
                throw new RejectedExecutionException("Session pool is shut down");
            }
            runnable.run();
        };
    }

    static TaskDecorator threadContextPropagator() {
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
