package com.phillippitts.modelorchestrator.service.orchestration;

import com.phillippitts.modelorchestrator.domain.ErrorClass;
import com.phillippitts.modelorchestrator.domain.OrchestrationSummary;
import com.phillippitts.modelorchestrator.domain.Outcome;
import com.phillippitts.modelorchestrator.domain.RetryResult;
import com.phillippitts.modelorchestrator.service.retry.RetryController;
import com.phillippitts.modelorchestrator.util.LogSanitizer;
import com.phillippitts.modelorchestrator.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs the retry loop of every requested model concurrently and waits for all of them.
 *
 * <p>One task per list entry is submitted to the model executor, so duplicated ids run twice.
 * Each task is wrapped so that any exception it raises (unsupported model, invoker defect,
 * executor rejection) becomes an unknown_error {@link RetryResult} for that model only; siblings
 * are never cancelled. The coordinator waits for every task to settle, with no early exit on
 * first success or first failure, and then reduces the results in input order.
 *
 * <p>There is no run-level deadline. Each task is bounded by
 * {@code timeoutMs * (maxRetries + 1)} plus cumulative backoff.
 */
public class FanOutCoordinator {

    private static final Logger LOG = LogManager.getLogger(FanOutCoordinator.class);

    static final String RUN_ID_KEY = "runId";
    static final String MODEL_KEY = "model";
    private static final int PROMPT_PREVIEW_CHARS = 60;

    private final RetryController retryController;
    private final Executor executor;

    /**
     * @param retryController per-model retry loop
     * @param executor        executor providing true parallelism for model tasks
     */
    public FanOutCoordinator(RetryController retryController, Executor executor) {
        this.retryController = Objects.requireNonNull(retryController, "retryController");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public OrchestrationSummary orchestrate(List<String> models, String prompt, long timeoutMs, int maxRetries) {
        return orchestrate(models, prompt, timeoutMs, maxRetries, RunContext.create());
    }

    public OrchestrationSummary orchestrate(List<String> models,
                                            String prompt,
                                            long timeoutMs,
                                            int maxRetries,
                                            RunContext context) {
        Objects.requireNonNull(models, "models");
        Objects.requireNonNull(context, "context");
        long start = System.nanoTime();
        LOG.info("Orchestration {} started: {} model(s) {}, timeout={}ms, maxRetries={}, prompt=\"{}\"",
                context.runId(), models.size(), models, timeoutMs, maxRetries,
                LogSanitizer.preview(prompt, PROMPT_PREVIEW_CHARS));

        List<CompletableFuture<RetryResult>> futures = new ArrayList<>(models.size());
        for (String model : models) {
            futures.add(launch(model, prompt, timeoutMs, maxRetries, context));
        }
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();

        List<RetryResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<RetryResult> future : futures) {
            results.add(future.join());
        }
        OrchestrationSummary summary = ResultReducer.reduce(results, TimeUtils.elapsedMillis(start), Instant.now());
        LOG.info("Orchestration {} complete: {}/{} succeeded in {}ms ({} attempt(s))",
                context.runId(), summary.successCount(), summary.totalModels(),
                summary.wallClockDurationMs(), context.totalAttempts());
        return summary;
    }

    private CompletableFuture<RetryResult> launch(String model, String prompt, long timeoutMs, int maxRetries,
                                                  RunContext context) {
        long submitted = System.nanoTime();
        CompletableFuture<RetryResult> future;
        try {
            future = CompletableFuture.supplyAsync(
                    () -> runInContext(model, prompt, timeoutMs, maxRetries, context), executor);
        } catch (RejectedExecutionException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future.handle((result, error) -> {
            if (error == null && result != null) {
                return result;
            }
            Throwable cause = unwrap(error);
            String message = cause == null ? "Task produced no result"
                    : cause.getClass().getSimpleName() + ": " + cause.getMessage();
            LOG.error("Model task for {} failed unexpectedly: {}", model, message);
            return RetryResult.failure(model,
                    Outcome.failure(model, ErrorClass.UNKNOWN_ERROR, message, 0),
                    0,
                    TimeUtils.elapsedMillis(submitted));
        });
    }

    private RetryResult runInContext(String model, String prompt, long timeoutMs, int maxRetries,
                                     RunContext context) {
        String previousRunId = ThreadContext.get(RUN_ID_KEY);
        String previousModel = ThreadContext.get(MODEL_KEY);
        ThreadContext.put(RUN_ID_KEY, context.runId());
        ThreadContext.put(MODEL_KEY, model);
        try {
            return retryController.runWithRetry(model, prompt, timeoutMs, maxRetries, context);
        } finally {
            restore(RUN_ID_KEY, previousRunId);
            restore(MODEL_KEY, previousModel);
        }
    }

    private static void restore(String key, String previous) {
        if (previous == null) {
            ThreadContext.remove(key);
        } else {
            ThreadContext.put(key, previous);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
