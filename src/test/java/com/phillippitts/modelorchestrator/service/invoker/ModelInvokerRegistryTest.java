package com.phillippitts.modelorchestrator.service.invoker;

import com.phillippitts.modelorchestrator.exception.UnsupportedModelException;
import com.phillippitts.modelorchestrator.testutil.ScriptedModelInvoker;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelInvokerRegistryTest {

    private final ScriptedModelInvoker gemini = ScriptedModelInvoker.succeeding("gemini");
    private final ModelInvokerRegistry registry = new ModelInvokerRegistry(List.of(
            gemini, ScriptedModelInvoker.builder("claude").succeed("x").notReady().build()));

    @Test
    void resolvesCaseInsensitively() {
        assertThat(registry.resolve(" Gemini ")).isSameAs(gemini);
        assertThat(registry.supports("CLAUDE")).isTrue();
        assertThat(registry.supports(null)).isFalse();
    }

    @Test
    void unknownModelThrows() {
        assertThatThrownBy(() -> registry.resolve("llama"))
                .isInstanceOf(UnsupportedModelException.class)
                .hasMessage("Unsupported model: llama");
    }

    @Test
    void reportsModelsAndReadinessInRegistrationOrder() {
        assertThat(registry.supportedModels()).containsExactly("gemini", "claude");
        assertThat(registry.readiness()).containsExactly(
                org.assertj.core.api.Assertions.entry("gemini", true),
                org.assertj.core.api.Assertions.entry("claude", false));
    }

    @Test
    void rejectsDuplicateRegistration() {
        assertThatThrownBy(() -> new ModelInvokerRegistry(List.of(
                ScriptedModelInvoker.succeeding("gemini"), ScriptedModelInvoker.succeeding("GEMINI"))))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
