package com.phillippitts.modelorchestrator.service.invoker;

import com.phillippitts.modelorchestrator.service.events.ModelThrottledEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Bounds in-flight calls to one model with a semaphore.
 *
 * <p>Waits up to the configured timeout for a permit. When none becomes available a
 * {@link ModelThrottledEvent} is published and {@link #tryAcquire()} returns false.
 *
 * <pre>{@code
 * if (!guard.tryAcquire()) {
 *     return rateLimited();
 * }
 * try {
 *     ... call the model ...
 * } finally {
 *     guard.release();
 * }
 * }</pre>
 *
 * <p>Thread-safe.
 */
public final class ConcurrencyGuard {

    private final Semaphore semaphore;
    private final long timeoutMs;
    private final String modelName;
    private final ApplicationEventPublisher publisher;

    /**
     * @param semaphore controls concurrent access
     * @param timeoutMs maximum wait for a permit in milliseconds
     * @param modelName model name for events
     * @param publisher event publisher for throttling notifications (nullable)
     */
    public ConcurrencyGuard(Semaphore semaphore, long timeoutMs, String modelName, ApplicationEventPublisher publisher) {
        this.semaphore = semaphore;
        this.timeoutMs = timeoutMs;
        this.modelName = modelName;
        this.publisher = publisher;
    }

    /**
     * @return true when a permit was acquired and must be released
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean tryAcquire() throws InterruptedException {
        boolean acquired = semaphore.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS);
        if (!acquired) {
            publishThrottled();
        }
        return acquired;
    }

    public void release() {
        semaphore.release();
    }

    public int availablePermits() {
        return semaphore.availablePermits();
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    private void publishThrottled() {
        if (publisher != null) {
            publisher.publishEvent(new ModelThrottledEvent(
                    modelName,
                    Instant.now(),
                    "concurrency limit reached after " + timeoutMs + "ms wait",
                    Map.of("reason", "concurrency-limit", "timeoutMs", String.valueOf(timeoutMs))
            ));
        }
    }
}
