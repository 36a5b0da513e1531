package com.phillippitts.modelorchestrator.service.orchestration;

import com.phillippitts.modelorchestrator.config.properties.OrchestrationProperties;
import com.phillippitts.modelorchestrator.domain.ErrorClass;
import com.phillippitts.modelorchestrator.domain.OrchestrationSummary;
import com.phillippitts.modelorchestrator.exception.InvalidOrchestrationRequestException;
import com.phillippitts.modelorchestrator.service.invoker.ModelInvokerRegistry;
import com.phillippitts.modelorchestrator.service.metrics.OrchestrationMetrics;
import com.phillippitts.modelorchestrator.service.metrics.OrchestrationMetricsPublisher;
import com.phillippitts.modelorchestrator.service.orchestration.event.OrchestrationCompletedEvent;
import com.phillippitts.modelorchestrator.service.retry.BackoffPolicy;
import com.phillippitts.modelorchestrator.service.retry.RetryController;
import com.phillippitts.modelorchestrator.testutil.EventCapturingPublisher;
import com.phillippitts.modelorchestrator.testutil.RecordingSleeper;
import com.phillippitts.modelorchestrator.testutil.ScriptedModelInvoker;
import com.phillippitts.modelorchestrator.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrchestrationServiceTest {

    private EventCapturingPublisher events;
    private SimpleMeterRegistry meters;
    private ScriptedModelInvoker gemini;
    private OrchestrationService service;

    @BeforeEach
    void setUp() {
        events = new EventCapturingPublisher();
        meters = new SimpleMeterRegistry();
        gemini = ScriptedModelInvoker.succeeding("gemini");
        ModelInvokerRegistry registry = new ModelInvokerRegistry(List.of(
                gemini, ScriptedModelInvoker.failing("claude", ErrorClass.AUTH_ERROR)));
        OrchestrationMetricsPublisher metrics = new OrchestrationMetricsPublisher(new OrchestrationMetrics(meters));
        RetryController retry = new RetryController(registry, new BackoffPolicy(1000, 8000),
                new RecordingSleeper(), metrics);
        OrchestrationProperties properties =
                new OrchestrationProperties(1000L, 5000L, 1, List.of("gemini"), true);
        service = new OrchestrationService(new OrchestrationRequestValidator(properties, registry),
                new FanOutCoordinator(retry, new SyncExecutor()), events, metrics);
    }

    @Test
    void publishesCompletionEventAndRecordsRun() {
        OrchestrationSummary summary = service.orchestrate(List.of("gemini", "claude"), "hello", null, null);

        assertThat(summary.overallSuccess()).isTrue();
        assertThat(events.eventsOfType(OrchestrationCompletedEvent.class)).singleElement()
                .satisfies(e -> {
                    assertThat(e.summary()).isSameAs(summary);
                    assertThat(e.runId()).hasSize(8);
                });
        assertThat(meters.find("orchestrator.run").tag("outcome", "success").timer()).isNotNull();
        assertThat(meters.find("orchestrator.model.failure").tag("errorClass", "auth_error").counter().count())
                .isEqualTo(1.0);
        assertThat(ThreadContext.get(FanOutCoordinator.RUN_ID_KEY)).isNull();
    }

    @Test
    void invalidInputContactsNoModel() {
        assertThatThrownBy(() -> service.orchestrate(List.of("gemini"), "", null, null))
                .isInstanceOf(InvalidOrchestrationRequestException.class);

        assertThat(gemini.calls()).isZero();
        assertThat(events.eventsOfType(OrchestrationCompletedEvent.class)).isEmpty();
    }
}
