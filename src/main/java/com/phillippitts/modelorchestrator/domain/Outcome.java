package com.phillippitts.modelorchestrator.domain;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of one invocation attempt: either {@link Success} or a classified {@link Failure}.
 *
 * <p>Produced by a {@code ModelInvoker}, consumed by the retry loop, never mutated.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "status")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Outcome.Success.class, name = "success"),
        @JsonSubTypes.Type(value = Outcome.Failure.class, name = "failure")
})
public sealed interface Outcome permits Outcome.Success, Outcome.Failure {

    String model();

    long durationMs();

    /**
     * @param model        model that produced the output
     * @param output       generated text
     * @param durationMs   duration of the attempt
     * @param timestampUTC completion time
     */
    record Success(String model, String output, long durationMs, Instant timestampUTC) implements Outcome {
        public Success {
            Objects.requireNonNull(model, "model");
            Objects.requireNonNull(output, "output");
            Objects.requireNonNull(timestampUTC, "timestampUTC");
            durationMs = Math.max(0, durationMs);
        }
    }

    /**
     * @param model        model that failed
     * @param errorMessage human-readable reason
     * @param errorClass   classification driving the retry decision
     * @param durationMs   duration of the attempt
     */
    record Failure(String model, String errorMessage, ErrorClass errorClass, long durationMs) implements Outcome {
        public Failure {
            Objects.requireNonNull(model, "model");
            Objects.requireNonNull(errorClass, "errorClass");
            errorMessage = errorMessage == null ? "" : errorMessage;
            durationMs = Math.max(0, durationMs);
        }
    }

    static Success success(String model, String output, long durationMs) {
        return new Success(model, output, durationMs, Instant.now());
    }

    static Failure failure(String model, ErrorClass errorClass, String errorMessage, long durationMs) {
        return new Failure(model, errorMessage, errorClass, durationMs);
    }
}
