package com.phillippitts.modelorchestrator.config;

import com.phillippitts.modelorchestrator.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors for orchestration runs.
 *
 * <ul>
 *   <li>{@code modelExecutor} runs one task per requested model (the whole retry loop, mostly
 *       blocked on network I/O or backoff). It uses a hand-off queue so each task gets its own
 *       thread immediately. Rejection policy {@link ThreadPoolExecutor.CallerRunsPolicy}: past
 *       the max pool size the submitting thread runs the task, so every model still gets its
 *       result.</li>
 *   <li>{@code invokerExecutor} runs single guarded attempts so the caller can stop waiting at
 *       the per-attempt timeout. Rejection policy {@link ThreadPoolExecutor.AbortPolicy}: a
 *       saturated pool fails the attempt with rate_limit_error, which is retried.</li>
 * </ul>
 *
 * <p>Both copy Log4j2's ThreadContext from the submitting thread so {@code runId} and
 * {@code model} appear on worker log lines.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    @Bean(name = "modelExecutor")
    public ThreadPoolTaskExecutor modelExecutor() {
        return build(threadPoolProperties.getModel(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    @Bean(name = "invokerExecutor")
    public ThreadPoolTaskExecutor invokerExecutor() {
        return build(threadPoolProperties.getInvoker(), new ThreadPoolExecutor.AbortPolicy());
    }

    private static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props,
                                                RejectedExecutionHandler rejectionPolicy) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejectionPolicy);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(threadContextPropagator());
        executor.initialize();
        return executor;
    }

    static TaskDecorator threadContextPropagator() {
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
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
