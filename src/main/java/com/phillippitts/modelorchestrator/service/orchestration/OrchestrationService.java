package com.phillippitts.modelorchestrator.service.orchestration;

import com.phillippitts.modelorchestrator.domain.OrchestrationRequest;
import com.phillippitts.modelorchestrator.domain.OrchestrationSummary;
import com.phillippitts.modelorchestrator.service.metrics.OrchestrationMetricsPublisher;
import com.phillippitts.modelorchestrator.service.orchestration.event.OrchestrationCompletedEvent;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.Objects;

/**
 * Entry point shared by the CLI and the REST API: validate, fan out, publish, record.
 */
public class OrchestrationService {

    private final OrchestrationRequestValidator validator;
    private final FanOutCoordinator coordinator;
    private final ApplicationEventPublisher publisher;
    private final OrchestrationMetricsPublisher metrics;

    public OrchestrationService(OrchestrationRequestValidator validator,
                                FanOutCoordinator coordinator,
                                ApplicationEventPublisher publisher,
                                OrchestrationMetricsPublisher metrics) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = metrics == null ? OrchestrationMetricsPublisher.NOOP : metrics;
    }

    /**
     * Validates raw input and runs it. Null values take configured defaults.
     *
     * @throws com.phillippitts.modelorchestrator.exception.InvalidOrchestrationRequestException
     *         when the input is rejected; no model is contacted in that case
     */
    public OrchestrationSummary orchestrate(List<String> models, String prompt, Long timeoutMs, Integer maxRetries) {
        return orchestrate(validator.validate(models, prompt, timeoutMs, maxRetries));
    }

    public OrchestrationSummary orchestrate(OrchestrationRequest request) {
        RunContext context = RunContext.create();
        ThreadContext.put(FanOutCoordinator.RUN_ID_KEY, context.runId());
        try {
            OrchestrationSummary summary = coordinator.orchestrate(
                    request.models(), request.prompt(), request.timeoutMs(), request.maxRetries(), context);
            metrics.recordRun(summary);
            publisher.publishEvent(new OrchestrationCompletedEvent(context.runId(), summary));
            return summary;
        } finally {
            ThreadContext.remove(FanOutCoordinator.RUN_ID_KEY);
        }
    }
}
