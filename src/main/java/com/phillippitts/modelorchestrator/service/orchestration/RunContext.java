package com.phillippitts.modelorchestrator.service.orchestration;

import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * State scoped to one orchestration run and handed explicitly to every model task.
 *
 * <p>The attempt counter is the only mutable part and is updated atomically from all model
 * tasks; it is used for logging only and never influences retry decisions.
 */
public final class RunContext {

    private final String runId;
    private final AtomicInteger attempts = new AtomicInteger();

    public RunContext(String runId) {
        this.runId = Objects.requireNonNull(runId, "runId");
    }

    public static RunContext create() {
        return new RunContext(UUID.randomUUID().toString().substring(0, 8));
    }

    public String runId() {
        return runId;
    }

    /**
     * @return running total of attempts across all models of this run
     */
    public int recordAttempt() {
        return attempts.incrementAndGet();
    }

    public int totalAttempts() {
        return attempts.get();
    }
}
