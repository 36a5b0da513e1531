package com.phillippitts.modelorchestrator.exception;

/**
 * Thrown when a model identifier has no registered backend.
 */
public class UnsupportedModelException extends ModelOrchestratorException {

    private final String modelName;

    public UnsupportedModelException(String modelName) {
        super("Unsupported model: " + modelName);
        this.modelName = modelName;
    }

    public String getModelName() {
        return modelName;
    }
}
