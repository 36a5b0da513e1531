package com.phillippitts.modelorchestrator.service.orchestration.event;

import com.phillippitts.modelorchestrator.domain.OrchestrationSummary;

import java.util.Objects;

/**
 * Published after every orchestration run, whatever its overall result.
 *
 * @param runId   correlation id of the run (also in the log ThreadContext)
 * @param summary final summary
 */
public record OrchestrationCompletedEvent(String runId, OrchestrationSummary summary) {

    public OrchestrationCompletedEvent {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(summary, "summary");
    }
}
