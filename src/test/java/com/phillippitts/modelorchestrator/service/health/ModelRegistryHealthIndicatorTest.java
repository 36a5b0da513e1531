package com.phillippitts.modelorchestrator.service.health;

import com.phillippitts.modelorchestrator.service.invoker.ModelInvokerRegistry;
import com.phillippitts.modelorchestrator.testutil.ScriptedModelInvoker;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ModelRegistryHealthIndicatorTest {

    private static ScriptedModelInvoker ready(String name) {
        return ScriptedModelInvoker.succeeding(name);
    }

    private static ScriptedModelInvoker missingKey(String name) {
        return ScriptedModelInvoker.builder(name).succeed("x").notReady().build();
    }

    @Test
    void shouldReportUpWhenAllModelsReady() {
        Health health = new ModelRegistryHealthIndicator(
                new ModelInvokerRegistry(List.of(ready("gemini"), ready("claude")))).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("status", "All models ready");
        assertThat(health.getDetails()).containsEntry("gemini", "ready");
    }

    @Test
    void shouldReportDegradedWhenSomeKeysMissing() {
        Health health = new ModelRegistryHealthIndicator(
                new ModelInvokerRegistry(List.of(ready("gemini"), missingKey("claude")))).health();

        assertThat(health.getStatus()).isEqualTo(new Status("DEGRADED"));
        assertThat(health.getDetails()).containsEntry("claude", "missing-api-key");
    }

    @Test
    void shouldReportDownWhenNothingReady() {
        Health health = new ModelRegistryHealthIndicator(
                new ModelInvokerRegistry(List.of(missingKey("gemini")))).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("status", "No models available");
    }

    @Test
    void shouldReportDownForEmptyRegistry() {
        Health health = new ModelRegistryHealthIndicator(new ModelInvokerRegistry(List.of())).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
    }
}
