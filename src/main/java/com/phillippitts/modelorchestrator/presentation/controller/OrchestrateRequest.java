package com.phillippitts.modelorchestrator.presentation.controller;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

import java.util.List;

/**
 * Body of {@code POST /api/orchestrations}. Omitted fields take the configured defaults.
 *
 * @param models     model ids, duplicates allowed
 * @param prompt     prompt text
 * @param timeoutMs  per-attempt timeout, capped at the configured maximum
 * @param maxRetries retries after the first attempt
 */
record OrchestrateRequest(
        List<String> models,
        @NotBlank(message = "prompt must not be blank") String prompt,
        @Positive(message = "timeoutMs must be positive") Long timeoutMs,
        @Min(value = 0, message = "maxRetries must not be negative") Integer maxRetries
) {
}
