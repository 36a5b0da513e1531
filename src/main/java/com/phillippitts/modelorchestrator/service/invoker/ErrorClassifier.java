package com.phillippitts.modelorchestrator.service.invoker;

import com.phillippitts.modelorchestrator.domain.ErrorClass;
import com.phillippitts.modelorchestrator.exception.ModelInvocationException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Maps HTTP status codes, provider error types and exception chains onto {@link ErrorClass}.
 *
 * <p>Rules are evaluated in order; the first match wins:
 * <ol>
 *   <li>401/403: auth_error</li>
 *   <li>provider error type (e.g. {@code "rate_limit_error"} in an Anthropic error body)</li>
 *   <li>authentication wording: auth_error</li>
 *   <li>429 or rate-limit wording: rate_limit_error</li>
 *   <li>408 or timeout wording: timeout_error</li>
 *   <li>404 or "not found": not_found_error</li>
 *   <li>any other 4xx: invalid_request_error</li>
 *   <li>503, "overloaded" or "capacity": rate_limit_error</li>
 *   <li>everything else (5xx, network, parse problems): unknown_error</li>
 * </ol>
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
    }

    public static ErrorClass classify(Integer httpStatus, String providerType, String message) {
        int status = httpStatus == null ? -1 : httpStatus;
        if (status == 401 || status == 403) {
            return ErrorClass.AUTH_ERROR;
        }
        Optional<ErrorClass> fromProvider = fromProviderType(providerType);
        if (fromProvider.isPresent()) {
            return fromProvider.get();
        }
        String msg = message == null ? "" : message.toLowerCase(Locale.ROOT);

        if (msg.contains("invalid api key") || msg.contains("authentication") || msg.contains("unauthorized")) {
            return ErrorClass.AUTH_ERROR;
        }
        if (status == 429 || msg.contains("rate limit") || msg.contains("too many requests")) {
            return ErrorClass.RATE_LIMIT_ERROR;
        }
        if (status == 408 || msg.contains("timeout") || msg.contains("timed out")) {
            return ErrorClass.TIMEOUT_ERROR;
        }
        if (status == 404 || msg.contains("not found")) {
            return ErrorClass.NOT_FOUND_ERROR;
        }
        if (status >= 400 && status < 500) {
            return ErrorClass.INVALID_REQUEST_ERROR;
        }
        if (status == 503 || msg.contains("overloaded") || msg.contains("capacity")) {
            return ErrorClass.RATE_LIMIT_ERROR;
        }
        return ErrorClass.UNKNOWN_ERROR;
    }

    public static ErrorClass classify(Integer httpStatus, String message) {
        return classify(httpStatus, null, message);
    }

    /**
     * Classifies an exception by walking its cause chain.
     */
    public static ErrorClass classify(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof ModelInvocationException mie && mie.getErrorClass() != null) {
                return mie.getErrorClass();
            }
            if (t instanceof SocketTimeoutException
                    || t instanceof HttpTimeoutException
                    || t instanceof TimeoutException) {
                return ErrorClass.TIMEOUT_ERROR;
            }
            if (t instanceof RestClientResponseException rre) {
                return classify(rre.getStatusCode().value(), rre.getMessage());
            }
        }
        return classify(null, null, error == null ? null : error.getMessage());
    }

    /**
     * Provider-specific error types. Anthropic and OpenAI report types that either match the
     * taxonomy directly or have a close equivalent.
     */
    static Optional<ErrorClass> fromProviderType(String providerType) {
        if (providerType == null || providerType.isBlank()) {
            return Optional.empty();
        }
        Optional<ErrorClass> direct = ErrorClass.fromWireName(providerType);
        if (direct.isPresent()) {
            return direct;
        }
        return switch (providerType.trim().toLowerCase(Locale.ROOT)) {
            case "authentication_error", "permission_error", "unauthenticated", "permission_denied" ->
                    Optional.of(ErrorClass.AUTH_ERROR);
            case "overloaded_error", "insufficient_quota", "resource_exhausted" ->
                    Optional.of(ErrorClass.RATE_LIMIT_ERROR);
            case "invalid_argument" -> Optional.of(ErrorClass.INVALID_REQUEST_ERROR);
            case "not_found" -> Optional.of(ErrorClass.NOT_FOUND_ERROR);
            case "deadline_exceeded" -> Optional.of(ErrorClass.TIMEOUT_ERROR);
            default -> Optional.empty();
        };
    }
}
