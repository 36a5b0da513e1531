package com.phillippitts.modelorchestrator.exception;

/**
 * Thrown when caller input cannot start a run: blank prompt, empty model list,
 * non-positive timeout or negative retry count.
 */
public class InvalidOrchestrationRequestException extends ModelOrchestratorException {

    public InvalidOrchestrationRequestException(String message) {
        super(message);
    }
}
