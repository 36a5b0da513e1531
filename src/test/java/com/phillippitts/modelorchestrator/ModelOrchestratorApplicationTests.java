package com.phillippitts.modelorchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {
                "orchestrator.mock-models=true",
                "orchestrator.mock.failure-rate=0",
                "orchestrator.mock.max-latency-ms=0"
        })
class ModelOrchestratorApplicationTests {

    @Autowired
    private TestRestTemplate rest;

    @Autowired
    private ObjectMapper mapper;

    @Test
    void orchestratesMockModelsEndToEnd() throws Exception {
        ResponseEntity<String> response = rest.postForEntity("/api/orchestrations",
                Map.of("models", List.of("gemini", "claude", "gemini"), "prompt", "Explain recursion"),
                String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        JsonNode json = mapper.readTree(response.getBody());
        assertThat(json.get("overallSuccess").asBoolean()).isTrue();
        assertThat(json.get("totalModels").asInt()).isEqualTo(3);
        assertThat(json.get("successCount").asInt()).isEqualTo(3);
        assertThat(json.get("results").get(1).get("finalOutcome").get("output").asText())
                .isEqualTo("[MOCK claude] Response to: \"Explain recursion...\"");
    }

    @Test
    void unsupportedModelIsBadRequest() {
        ResponseEntity<String> response = rest.postForEntity("/api/orchestrations",
                Map.of("models", List.of("llama"), "prompt", "hi"), String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).contains("llama");
    }

    @Test
    void healthIsUpInMockMode() throws Exception {
        ResponseEntity<String> response = rest.getForEntity("/actuator/health", String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(mapper.readTree(response.getBody()).get("status").asText()).isEqualTo("UP");
    }
}
