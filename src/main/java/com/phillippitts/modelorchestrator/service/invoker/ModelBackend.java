package com.phillippitts.modelorchestrator.service.invoker;

/**
 * Finite set of model identifiers the registry can resolve.
 */
public enum ModelBackend {
    GEMINI("gemini"),
    CODEX("codex"),
    CLAUDE("claude"),
    GPT4("gpt4");

    private final String id;

    ModelBackend(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
