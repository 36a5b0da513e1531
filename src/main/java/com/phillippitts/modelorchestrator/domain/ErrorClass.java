package com.phillippitts.modelorchestrator.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Exhaustive classification of a failed model invocation.
 *
 * <p>The first three classes describe configuration or request-shape problems that a repeated
 * request cannot fix; the retry loop aborts on them. The remaining three are transient and
 * are retried with backoff while budget remains.
 */
public enum ErrorClass {

    AUTH_ERROR("auth_error", false),
    INVALID_REQUEST_ERROR("invalid_request_error", false),
    NOT_FOUND_ERROR("not_found_error", false),
    RATE_LIMIT_ERROR("rate_limit_error", true),
    TIMEOUT_ERROR("timeout_error", true),
    UNKNOWN_ERROR("unknown_error", true);

    private final String wireName;
    private final boolean retryable;

    ErrorClass(String wireName, boolean retryable) {
        this.wireName = wireName;
        this.retryable = retryable;
    }

    /**
     * Name used in JSON summaries and in provider error bodies (e.g. {@code rate_limit_error}).
     */
    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Looks up a class by its wire name, case-insensitively.
     *
     * @param wireName wire name such as {@code not_found_error}
     * @return matching class, or empty when the name is not part of the taxonomy
     */
    public static Optional<ErrorClass> fromWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        String normalized = wireName.trim().toLowerCase(Locale.ROOT);
        for (ErrorClass c : values()) {
            if (c.wireName.equals(normalized)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }
}
