package com.phillippitts.modelorchestrator.service.orchestration;

import com.phillippitts.modelorchestrator.config.properties.OrchestrationProperties;
import com.phillippitts.modelorchestrator.domain.OrchestrationRequest;
import com.phillippitts.modelorchestrator.exception.InvalidOrchestrationRequestException;
import com.phillippitts.modelorchestrator.service.invoker.ModelInvokerRegistry;
import com.phillippitts.modelorchestrator.testutil.ScriptedModelInvoker;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrchestrationRequestValidatorTest {

    private final OrchestrationProperties properties =
            new OrchestrationProperties(60_000L, 120_000L, 2, List.of("gemini"), false);
    private final ModelInvokerRegistry registry = new ModelInvokerRegistry(List.of(
            ScriptedModelInvoker.succeeding("gemini"),
            ScriptedModelInvoker.succeeding("claude")));
    private final OrchestrationRequestValidator validator = new OrchestrationRequestValidator(properties, registry);

    @Test
    void appliesDefaults() {
        OrchestrationRequest request = validator.validate(null, "hello", null, null);

        assertThat(request.models()).containsExactly("gemini");
        assertThat(request.timeoutMs()).isEqualTo(60_000L);
        assertThat(request.maxRetries()).isEqualTo(2);
    }

    @Test
    void normalizesModelIdsAndKeepsDuplicates() {
        OrchestrationRequest request = validator.validate(
                Arrays.asList(" Claude ", "", null, "gemini", "GEMINI"), "hello", 5000L, 0);

        assertThat(request.models()).containsExactly("claude", "gemini", "gemini");
        assertThat(request.maxRetries()).isZero();
    }

    @Test
    void capsTimeoutAtMaximum() {
        assertThat(validator.validate(List.of("gemini"), "hello", 500_000L, 1).timeoutMs()).isEqualTo(120_000L);
    }

    @Test
    void rejectsBlankPrompt() {
        assertThatThrownBy(() -> validator.validate(List.of("gemini"), "   ", null, null))
                .isInstanceOf(InvalidOrchestrationRequestException.class)
                .hasMessageContaining("Prompt");
    }

    @Test
    void rejectsListOfBlankModels() {
        assertThatThrownBy(() -> validator.validate(List.of(" ", ""), "hello", null, null))
                .isInstanceOf(InvalidOrchestrationRequestException.class)
                .hasMessageContaining("At least one model");
    }

    @Test
    void rejectsUnsupportedModelListingSupportedOnes() {
        assertThatThrownBy(() -> validator.validate(List.of("gemini", "llama"), "hello", null, null))
                .isInstanceOf(InvalidOrchestrationRequestException.class)
                .hasMessageContaining("llama")
                .hasMessageContaining("gemini, claude");
    }

    @Test
    void rejectsNonPositiveTimeoutAndNegativeRetries() {
        assertThatThrownBy(() -> validator.validate(null, "hello", 0L, null))
                .isInstanceOf(InvalidOrchestrationRequestException.class);
        assertThatThrownBy(() -> validator.validate(null, "hello", null, -1))
                .isInstanceOf(InvalidOrchestrationRequestException.class);
    }
}
