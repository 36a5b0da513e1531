package com.phillippitts.modelorchestrator.service.orchestration;

import com.phillippitts.modelorchestrator.domain.FailureSummary;
import com.phillippitts.modelorchestrator.domain.OrchestrationSummary;
import com.phillippitts.modelorchestrator.domain.RetryResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Folds per-model results into an {@link OrchestrationSummary}.
 *
 * <p>Partial success: the run is successful as soon as one model produced output. Input order is
 * preserved within the success and failure lists. Pure and side-effect free.
 */
public final class ResultReducer {

    private ResultReducer() {
    }

    public static OrchestrationSummary reduce(List<RetryResult> results, long wallClockDurationMs, Instant timestampUTC) {
        Objects.requireNonNull(results, "results");
        List<RetryResult> succeeded = new ArrayList<>();
        List<FailureSummary> failed = new ArrayList<>();
        for (RetryResult result : results) {
            if (result.succeeded()) {
                succeeded.add(result);
            } else {
                failed.add(FailureSummary.of(result));
            }
        }
        return new OrchestrationSummary(
                !succeeded.isEmpty(),
                results.size(),
                succeeded.size(),
                failed.size(),
                succeeded,
                failed,
                Math.max(0, wallClockDurationMs),
                timestampUTC
        );
    }
}
