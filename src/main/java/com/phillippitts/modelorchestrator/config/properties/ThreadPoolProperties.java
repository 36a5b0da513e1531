package com.phillippitts.modelorchestrator.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Sizing for the two executors of an orchestration run.
 *
 * <ul>
 *   <li>{@code threadpool.model} - one task per requested model; runs the whole retry loop</li>
 *   <li>{@code threadpool.invoker} - one task per attempt; bounded by the per-attempt timeout</li>
 * </ul>
 *
 * <p>A thread pool only grows past its core size once its queue is full, so the model pool keeps
 * a queue capacity of 0; otherwise entries beyond the core size would wait instead of running.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private PoolProperties model = new PoolProperties(4, 64, 0, "model-pool-");
    private PoolProperties invoker = new PoolProperties(4, 128, 0, "invoker-pool-");

    public PoolProperties getModel() {
        return model;
    }

    public void setModel(PoolProperties model) {
        this.model = model;
    }

    public PoolProperties getInvoker() {
        return invoker;
    }

    public void setInvoker(PoolProperties invoker) {
        this.invoker = invoker;
    }

    /**
     * Settings of one executor.
     */
    public static class PoolProperties {
        private int corePoolSize;
        private int maxPoolSize;
        private int queueCapacity;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix;

        public PoolProperties() {
        }

        PoolProperties(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
