package com.phillippitts.modelorchestrator.service.metrics;

import com.phillippitts.modelorchestrator.domain.Outcome;
import com.phillippitts.modelorchestrator.domain.OrchestrationSummary;
import com.phillippitts.modelorchestrator.domain.RetryResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Translates domain results into {@link OrchestrationMetrics} calls.
 *
 * <p>All methods tolerate a missing metrics backend so the core can run without a registry in
 * unit tests ({@link #NOOP}).
 */
@Component
public final class OrchestrationMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(OrchestrationMetricsPublisher.class);

    /** No-op instance for tests and wiring without a meter registry. */
    public static final OrchestrationMetricsPublisher NOOP = new OrchestrationMetricsPublisher(null);

    private final OrchestrationMetrics metrics;

    /**
     * @param metrics metrics backend (nullable for test mode)
     */
    public OrchestrationMetricsPublisher(OrchestrationMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("OrchestrationMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordAttempt(Outcome outcome) {
        if (metrics == null) {
            return;
        }
        String label = outcome instanceof Outcome.Failure f ? f.errorClass().wireName() : "success";
        metrics.incrementAttempt(outcome.model(), label);
    }

    public void recordResult(RetryResult result) {
        if (metrics == null) {
            return;
        }
        metrics.recordLatency(result.model(), result.totalDurationMs());
        if (result.finalOutcome() instanceof Outcome.Failure f) {
            metrics.incrementFailure(result.model(), f.errorClass().wireName());
        } else {
            metrics.incrementSuccess(result.model());
        }
    }

    public void recordRun(OrchestrationSummary summary) {
        if (metrics == null) {
            return;
        }
        metrics.recordRun(summary.overallSuccess(), summary.wallClockDurationMs());
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
