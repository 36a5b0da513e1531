package com.phillippitts.modelorchestrator.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Exponential backoff bounds between retry attempts.
 *
 * <pre>
 * orchestrator.retry.base-backoff-ms=1000
 * orchestrator.retry.max-backoff-ms=8000
 * </pre>
 *
 * @param baseBackoffMs delay before the first retry; doubled on each subsequent retry
 * @param maxBackoffMs  ceiling applied to every delay
 */
@ConfigurationProperties(prefix = "orchestrator.retry")
@Validated
public record RetryProperties(
        @Positive @DefaultValue("1000") long baseBackoffMs,
        @Positive @DefaultValue("8000") long maxBackoffMs
) {
}
