package com.phillippitts.modelorchestrator.cli;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OrchestrationCliRunnerTest {

    @Test
    void dropsSpringPropertyArguments() {
        String[] args = OrchestrationCliRunner.commandArgs(
                "--spring.profiles.active=cli", "-p", "hello", "--orchestrator.mock-models=true", "--models", "gemini");

        assertThat(args).containsExactly("-p", "hello", "--models", "gemini");
    }

    @Test
    void keepsCommandOptionsWithValues() {
        assertThat(OrchestrationCliRunner.commandArgs("--prompt=a.b", "--timeout=500"))
                .containsExactly("--prompt=a.b", "--timeout=500");
    }
}
