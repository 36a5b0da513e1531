package com.phillippitts.modelorchestrator.exception;

/**
 * Base exception for all model-orchestrator application-specific errors.
 * Domain exceptions extend this class so the web layer can map them in one place.
 */
public class ModelOrchestratorException extends RuntimeException {

    public ModelOrchestratorException(String message) {
        super(message);
    }

    public ModelOrchestratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
