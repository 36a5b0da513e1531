package com.phillippitts.modelorchestrator.domain;

import java.util.Objects;

/**
 * Input for a single invocation attempt against one model backend. Created once per attempt.
 *
 * @param model     model identifier (e.g. "gemini", "claude")
 * @param prompt    prompt text sent to the backend
 * @param timeoutMs upper bound for this attempt in milliseconds
 */
public record InvocationRequest(String model, String prompt, long timeoutMs) {

    public InvocationRequest {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(prompt, "prompt");
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive, got: " + timeoutMs);
        }
    }
}
