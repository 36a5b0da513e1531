package com.phillippitts.modelorchestrator.presentation.controller;

import com.phillippitts.modelorchestrator.domain.OrchestrationSummary;
import com.phillippitts.modelorchestrator.service.invoker.ModelInvokerRegistry;
import com.phillippitts.modelorchestrator.service.orchestration.OrchestrationService;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * HTTP entry point. A run where every model failed still answers 200; the
 * {@code overallSuccess} flag of the summary is the signal.
 */
@RestController
@RequestMapping("/api")
class OrchestrationController {

    private static final Logger LOG = LogManager.getLogger(OrchestrationController.class);

    private final OrchestrationService orchestrationService;
    private final ModelInvokerRegistry registry;

    OrchestrationController(OrchestrationService orchestrationService, ModelInvokerRegistry registry) {
        this.orchestrationService = orchestrationService;
        this.registry = registry;
    }

    @PostMapping("/orchestrations")
    ResponseEntity<OrchestrationSummary> orchestrate(@Valid @RequestBody OrchestrateRequest request) {
        LOG.info("Orchestration requested for models={}", request.models());
        OrchestrationSummary summary = orchestrationService.orchestrate(
                request.models(), request.prompt(), request.timeoutMs(), request.maxRetries());
        return ResponseEntity.ok(summary);
    }

    @GetMapping("/models")
    ResponseEntity<List<ModelStatus>> models() {
        List<ModelStatus> models = registry.readiness().entrySet().stream()
                .map(e -> new ModelStatus(e.getKey(), e.getValue()))
                .toList();
        return ResponseEntity.ok(models);
    }

    record ModelStatus(String id, boolean ready) {
    }
}
