package com.phillippitts.modelorchestrator.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Typed defaults for orchestration runs. Callers may override timeout, retries and model list
 * per request; the timeout is always capped at {@code maxTimeoutMs}.
 */
@Validated
@ConfigurationProperties(prefix = "orchestrator")
public class OrchestrationProperties {

    @Positive
    private final long defaultTimeoutMs;

    @Positive
    private final long maxTimeoutMs;

    @Min(0)
    private final int defaultMaxRetries;

    @NotEmpty
    private final List<String> defaultModels;

    /**
     * When true every model id resolves to the in-process mock backend instead of a remote API.
     */
    private final boolean mockModels;

    @ConstructorBinding
    public OrchestrationProperties(Long defaultTimeoutMs,
                                   Long maxTimeoutMs,
                                   Integer defaultMaxRetries,
                                   List<String> defaultModels,
                                   Boolean mockModels) {
        this.defaultTimeoutMs = defaultTimeoutMs == null ? 60_000L : defaultTimeoutMs;
        this.maxTimeoutMs = maxTimeoutMs == null ? 120_000L : maxTimeoutMs;
        this.defaultMaxRetries = defaultMaxRetries == null ? 2 : defaultMaxRetries;
        this.defaultModels = defaultModels == null || defaultModels.isEmpty()
                ? List.of("gemini") : List.copyOf(defaultModels);
        this.mockModels = mockModels != null && mockModels;
    }

    public long getDefaultTimeoutMs() {
        return defaultTimeoutMs;
    }

    public long getMaxTimeoutMs() {
        return maxTimeoutMs;
    }

    public int getDefaultMaxRetries() {
        return defaultMaxRetries;
    }

    public List<String> getDefaultModels() {
        return defaultModels;
    }

    public boolean isMockModels() {
        return mockModels;
    }
}
