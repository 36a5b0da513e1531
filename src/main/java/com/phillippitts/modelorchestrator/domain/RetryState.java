package com.phillippitts.modelorchestrator.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-model state within the retry loop.
 *
 * <pre>
 * PENDING -> ATTEMPTING -> SUCCEEDED
 *                       -> RETRY_WAIT -> ATTEMPTING
 *                       -> FAILED_TERMINAL
 * </pre>
 */
public enum RetryState {
    PENDING,
    ATTEMPTING,
    RETRY_WAIT,
    SUCCEEDED,
    FAILED_TERMINAL;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED_TERMINAL;
    }

    public boolean canTransitionTo(RetryState next) {
        return allowedNext().contains(next);
    }

    private Set<RetryState> allowedNext() {
        return switch (this) {
            case PENDING, RETRY_WAIT -> EnumSet.of(ATTEMPTING, FAILED_TERMINAL);
            case ATTEMPTING -> EnumSet.of(SUCCEEDED, RETRY_WAIT, FAILED_TERMINAL);
            case SUCCEEDED, FAILED_TERMINAL -> EnumSet.noneOf(RetryState.class);
        };
    }
}
