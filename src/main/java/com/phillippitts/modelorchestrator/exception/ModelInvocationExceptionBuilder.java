package com.phillippitts.modelorchestrator.exception;

import com.phillippitts.modelorchestrator.domain.ErrorClass;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link ModelInvocationException} with contextual details appended to the message.
 *
 * <pre>
 * throw ModelInvocationExceptionBuilder.create("Unexpected response shape")
 *         .model("claude")
 *         .errorClass(ErrorClass.UNKNOWN_ERROR)
 *         .httpStatus(200)
 *         .metadata("field", "content[0].text")
 *         .build();
 * </pre>
 *
 * Resulting message: {@code Unexpected response shape (httpStatus=200, field=content[0].text)}.
 */
public final class ModelInvocationExceptionBuilder {

    private final String message;
    private String modelName = "unknown";
    private ErrorClass errorClass = ErrorClass.UNKNOWN_ERROR;
    private Throwable cause;
    private Integer httpStatus;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ModelInvocationExceptionBuilder(String message) {
        this.message = message;
    }

    public static ModelInvocationExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ModelInvocationExceptionBuilder(message);
    }

    public ModelInvocationExceptionBuilder model(String modelName) {
        if (modelName != null) {
            this.modelName = modelName;
        }
        return this;
    }

    public ModelInvocationExceptionBuilder errorClass(ErrorClass errorClass) {
        if (errorClass != null) {
            this.errorClass = errorClass;
        }
        return this;
    }

    public ModelInvocationExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public ModelInvocationExceptionBuilder httpStatus(int httpStatus) {
        this.httpStatus = httpStatus;
        return this;
    }

    /**
     * Adds a key/value pair to the message. Null keys or values are ignored.
     */
    public ModelInvocationExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public ModelInvocationException build() {
        return new ModelInvocationException(buildDetailedMessage(), modelName, errorClass, httpStatus, cause);
    }

    private String buildDetailedMessage() {
        if (httpStatus == null && metadata.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        if (httpStatus != null) {
            sb.append("httpStatus=").append(httpStatus);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
