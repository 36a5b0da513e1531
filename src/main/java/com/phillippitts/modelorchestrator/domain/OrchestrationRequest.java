package com.phillippitts.modelorchestrator.domain;

import java.util.List;
import java.util.Objects;

/**
 * Normalized caller input for one orchestration run. Duplicated model ids are kept.
 */
public record OrchestrationRequest(List<String> models, String prompt, long timeoutMs, int maxRetries) {

    public OrchestrationRequest {
        models = List.copyOf(models);
        Objects.requireNonNull(prompt, "prompt");
    }
}
