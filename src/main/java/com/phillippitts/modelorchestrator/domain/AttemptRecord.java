package com.phillippitts.modelorchestrator.domain;

import java.util.Objects;

/**
 * One entry of a model's retry loop.
 *
 * @param attemptIndex     zero-based attempt index
 * @param backoffAppliedMs backoff slept before this attempt (0 for the first one)
 * @param outcome          what the attempt produced
 */
public record AttemptRecord(int attemptIndex, long backoffAppliedMs, Outcome outcome) {

    public AttemptRecord {
        if (attemptIndex < 0) {
            throw new IllegalArgumentException("attemptIndex must be >= 0");
        }
        Objects.requireNonNull(outcome, "outcome");
    }
}
