package com.phillippitts.modelorchestrator.domain;

import java.util.Objects;

/**
 * Failure entry of an {@link OrchestrationSummary}: enough detail to debug a backend and to
 * route programmatically ("retry later" for transient classes, "fix config" for the others).
 */
public record FailureSummary(String model, ErrorClass errorClass, String errorMessage, int attemptsMade) {

    public FailureSummary {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(errorClass, "errorClass");
        errorMessage = errorMessage == null ? "" : errorMessage;
    }

    public static FailureSummary of(RetryResult result) {
        if (!(result.finalOutcome() instanceof Outcome.Failure failure)) {
            throw new IllegalArgumentException("Not a failed result: " + result.model());
        }
        return new FailureSummary(result.model(), failure.errorClass(), failure.errorMessage(), result.attemptsMade());
    }
}
