package com.phillippitts.modelorchestrator.domain;

import java.util.Objects;

/**
 * Final, post-retry result for one model within one orchestration run.
 *
 * @param model           model identifier
 * @param succeeded       true when {@code finalOutcome} is a {@link Outcome.Success}
 * @param finalOutcome    last outcome of the loop (the success, or the last failure)
 * @param attemptsMade    number of invocation attempts actually made
 * @param totalDurationMs wall-clock time across all attempts, backoff sleeps included
 */
public record RetryResult(
        String model,
        boolean succeeded,
        Outcome finalOutcome,
        int attemptsMade,
        long totalDurationMs
) {

    public RetryResult {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(finalOutcome, "finalOutcome");
        if (succeeded != (finalOutcome instanceof Outcome.Success)) {
            throw new IllegalArgumentException("succeeded flag does not match final outcome for " + model);
        }
        if (attemptsMade < 0) {
            throw new IllegalArgumentException("attemptsMade must be >= 0");
        }
        totalDurationMs = Math.max(0, totalDurationMs);
    }

    public static RetryResult success(String model, Outcome.Success outcome, int attemptsMade, long totalDurationMs) {
        return new RetryResult(model, true, outcome, attemptsMade, totalDurationMs);
    }

    public static RetryResult failure(String model, Outcome.Failure outcome, int attemptsMade, long totalDurationMs) {
        return new RetryResult(model, false, outcome, attemptsMade, totalDurationMs);
    }
}
