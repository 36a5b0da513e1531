package com.phillippitts.modelorchestrator.config;

import com.phillippitts.modelorchestrator.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    private final ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());
    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdown();
        }
        ThreadContext.clearMap();
    }

    @Test
    void modelExecutorUsesConfiguredDefaults() {
        executor = config.modelExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(4);
        assertThat(executor.getMaxPoolSize()).isEqualTo(64);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("model-pool-");
        assertThat(executor.getThreadPoolExecutor().getQueue().remainingCapacity()).isZero();
    }

    @Test
    void modelExecutorStartsTasksBeyondCoreSizeAtOnce() throws InterruptedException {
        executor = config.modelExecutor();
        int tasks = executor.getCorePoolSize() * 2;
        CountDownLatch allRunning = new CountDownLatch(tasks);
        CountDownLatch release = new CountDownLatch(1);

        try {
            for (int i = 0; i < tasks; i++) {
                executor.execute(() -> {
                    allRunning.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
            }

            assertThat(allRunning.await(2, TimeUnit.SECONDS)).isTrue();
            assertThat(executor.getThreadPoolExecutor().getQueue()).isEmpty();
        } finally {
            release.countDown();
        }
    }

    @Test
    void shouldUseCorrectThreadNamePrefix() throws InterruptedException {
        executor = config.invokerExecutor();
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> threadName = new AtomicReference<>();

        executor.execute(() -> {
            threadName.set(Thread.currentThread().getName());
            latch.countDown();
        });

        assertThat(latch.await(1, TimeUnit.SECONDS)).isTrue();
        assertThat(threadName.get()).startsWith("invoker-pool-");
    }

    @Test
    void propagatesThreadContextToWorkers() throws InterruptedException {
        executor = config.modelExecutor();
        ThreadContext.put("runId", "run-42");
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> seen = new AtomicReference<>();

        executor.execute(() -> {
            seen.set(ThreadContext.get("runId"));
            latch.countDown();
        });

        assertThat(latch.await(1, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("run-42");
    }

    @Test
    void invokerExecutorRejectsWhenSaturated() throws InterruptedException {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getInvoker().setCorePoolSize(1);
        properties.getInvoker().setMaxPoolSize(1);
        executor = new ThreadPoolConfig(properties).invokerExecutor();
        CountDownLatch release = new CountDownLatch(1);
        executor.execute(() -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        try {
            assertThatThrownBy(() -> executor.execute(() -> { }))
                    .isInstanceOf(TaskRejectedException.class);
        } finally {
            release.countDown();
        }
    }
}
