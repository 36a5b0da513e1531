package com.phillippitts.modelorchestrator.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Behavior of the in-process mock backend used when {@code orchestrator.mock-models=true}.
 *
 * @param failureRate   probability in [0, 1] that an attempt fails with rate_limit_error
 * @param maxLatencyMs  upper bound of the simulated latency
 * @param seed          random seed; 0 means nondeterministic
 */
@ConfigurationProperties(prefix = "orchestrator.mock")
@Validated
public record MockModelProperties(
        @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.1") double failureRate,
        @Min(0) @DefaultValue("1500") long maxLatencyMs,
        @DefaultValue("0") long seed
) {
}
