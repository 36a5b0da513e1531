package com.phillippitts.modelorchestrator.service.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.phillippitts.modelorchestrator.domain.FailureSummary;
import com.phillippitts.modelorchestrator.domain.OrchestrationSummary;
import com.phillippitts.modelorchestrator.domain.Outcome;
import com.phillippitts.modelorchestrator.domain.RetryResult;
import com.phillippitts.modelorchestrator.exception.ModelOrchestratorException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Renders and logs orchestration summaries.
 *
 * <p>JSON uses the summary's own field names, error classes by wire name and timestamps as
 * ISO-8601 strings.
 */
@Component
public class SummaryReporter {

    private static final Logger LOG = LogManager.getLogger(SummaryReporter.class);

    private final ObjectMapper mapper;

    public SummaryReporter(ObjectMapper objectMapper) {
        this.mapper = objectMapper.copy()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(OrchestrationSummary summary) {
        try {
            return mapper.writeValueAsString(summary);
        } catch (JsonProcessingException e) {
            throw new ModelOrchestratorException("Failed to serialize orchestration summary", e);
        }
    }

    /**
     * Plain-text block per successful model, in result order.
     */
    public String renderOutputs(OrchestrationSummary summary) {
        StringBuilder sb = new StringBuilder();
        for (RetryResult result : summary.results()) {
            if (result.finalOutcome() instanceof Outcome.Success success) {
                sb.append("=== ").append(result.model()).append(" ===").append(System.lineSeparator())
                        .append(success.output()).append(System.lineSeparator())
                        .append(System.lineSeparator());
            }
        }
        return sb.toString();
    }

    public void logSummary(OrchestrationSummary summary) {
        if (summary.successCount() > 0) {
            LOG.info("Successful models: {}", summary.results().stream()
                    .map(RetryResult::model)
                    .collect(Collectors.joining(", ")));
        }
        for (FailureSummary failure : summary.failures()) {
            LOG.warn("Failed model: {} ({}) after {} attempt(s): {}", failure.model(),
                    failure.errorClass().wireName(), failure.attemptsMade(), failure.errorMessage());
        }
        if (summary.overallSuccess()) {
            LOG.info("Orchestration succeeded: {}/{} model(s) in {}ms",
                    summary.successCount(), summary.totalModels(), summary.wallClockDurationMs());
        } else {
            LOG.error("Orchestration failed: all {} model(s) failed", summary.totalModels());
        }
    }
}
