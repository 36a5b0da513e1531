package com.phillippitts.modelorchestrator.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Per-model in-flight caps. Protects a provider's rate limit when several runs (or duplicated
 * model ids inside one run) target the same backend at once.
 *
 * <ul>
 *   <li>orchestrator.concurrency.max-in-flight-per-model - parallel calls per model (default: 4)</li>
 *   <li>orchestrator.concurrency.acquire-timeout-ms - wait for a permit before failing the
 *       attempt with rate_limit_error (default: 1000, 0 fails fast)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "orchestrator.concurrency")
@Validated
public class ConcurrencyProperties {

    @Positive(message = "Max in-flight calls per model must be positive")
    private int maxInFlightPerModel = 4;

    @Min(value = 0, message = "Acquire timeout must not be negative")
    private int acquireTimeoutMs = 1000;

    public int getMaxInFlightPerModel() {
        return maxInFlightPerModel;
    }

    public void setMaxInFlightPerModel(int maxInFlightPerModel) {
        this.maxInFlightPerModel = maxInFlightPerModel;
    }

    public int getAcquireTimeoutMs() {
        return acquireTimeoutMs;
    }

    public void setAcquireTimeoutMs(int acquireTimeoutMs) {
        this.acquireTimeoutMs = acquireTimeoutMs;
    }
}
