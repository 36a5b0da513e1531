package com.phillippitts.modelorchestrator.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Read-only outcome of one orchestration run, shaped for direct JSON serialization.
 *
 * <p>Invariants checked on construction: {@code successCount + failureCount == totalModels},
 * {@code overallSuccess == (successCount > 0)}, list sizes match the counts.
 *
 * @param overallSuccess      partial-success flag: at least one model produced output
 * @param totalModels         number of requested models (duplicates counted)
 * @param successCount        number of successful models
 * @param failureCount        number of failed models
 * @param results             successful results only
 * @param failures            failed models with classification and attempt count
 * @param wallClockDurationMs duration of the whole run
 * @param timestampUTC        completion time
 */
public record OrchestrationSummary(
        boolean overallSuccess,
        int totalModels,
        int successCount,
        int failureCount,
        List<RetryResult> results,
        List<FailureSummary> failures,
        long wallClockDurationMs,
        Instant timestampUTC
) {

    public OrchestrationSummary {
        results = List.copyOf(results);
        failures = List.copyOf(failures);
        Objects.requireNonNull(timestampUTC, "timestampUTC");
        if (results.size() != successCount || failures.size() != failureCount) {
            throw new IllegalArgumentException("Counts do not match result lists");
        }
        if (successCount + failureCount != totalModels) {
            throw new IllegalArgumentException("successCount + failureCount must equal totalModels");
        }
        if (overallSuccess != (successCount > 0)) {
            throw new IllegalArgumentException("overallSuccess must be true iff at least one model succeeded");
        }
    }
}
