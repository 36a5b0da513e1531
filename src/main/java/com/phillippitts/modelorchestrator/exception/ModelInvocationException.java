package com.phillippitts.modelorchestrator.exception;

import com.phillippitts.modelorchestrator.domain.ErrorClass;

import java.util.Optional;

/**
 * Thrown inside an adapter when a backend call fails in a way the adapter already classified.
 * Adapters convert it to an {@code Outcome.Failure} before returning; it never crosses the
 * {@code ModelInvoker} boundary.
 */
public class ModelInvocationException extends ModelOrchestratorException {

    private final String modelName;
    private final ErrorClass errorClass;
    private final Integer httpStatus;

    public ModelInvocationException(String message, String modelName, ErrorClass errorClass) {
        this(message, modelName, errorClass, null, null);
    }

    public ModelInvocationException(String message, String modelName, ErrorClass errorClass, Throwable cause) {
        this(message, modelName, errorClass, null, cause);
    }

    /**
     * @param httpStatus status of the backend response, or {@code null} when no response was received
     */
    public ModelInvocationException(String message, String modelName, ErrorClass errorClass,
                                    Integer httpStatus, Throwable cause) {
        super(message, cause);
        this.modelName = modelName;
        this.errorClass = errorClass;
        this.httpStatus = httpStatus;
    }

    public String getModelName() {
        return modelName;
    }

    public ErrorClass getErrorClass() {
        return errorClass;
    }

    public Optional<Integer> getHttpStatus() {
        return Optional.ofNullable(httpStatus);
    }
}
