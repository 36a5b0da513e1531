package com.phillippitts.modelorchestrator.service.retry;

import com.phillippitts.modelorchestrator.domain.AttemptRecord;
import com.phillippitts.modelorchestrator.domain.ErrorClass;
import com.phillippitts.modelorchestrator.domain.InvocationRequest;
import com.phillippitts.modelorchestrator.domain.Outcome;
import com.phillippitts.modelorchestrator.domain.RetryResult;
import com.phillippitts.modelorchestrator.domain.RetryState;
import com.phillippitts.modelorchestrator.service.invoker.ModelInvoker;
import com.phillippitts.modelorchestrator.service.invoker.ModelInvokerRegistry;
import com.phillippitts.modelorchestrator.service.metrics.OrchestrationMetricsPublisher;
import com.phillippitts.modelorchestrator.service.orchestration.RunContext;
import com.phillippitts.modelorchestrator.util.Sleeper;
import com.phillippitts.modelorchestrator.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs one model's invocation with bounded retries, without knowledge of sibling models.
 *
 * <p>Attempts run sequentially with indices {@code 0..maxRetries}. Before every attempt after the
 * first the controller sleeps for {@link BackoffPolicy#delayBeforeAttempt(int)}. The loop ends:
 * <ul>
 *   <li>on the first success</li>
 *   <li>on a non-retryable failure (auth, invalid request, not found), without consuming the
 *       remaining budget</li>
 *   <li>when the budget is exhausted, reporting the last failure</li>
 * </ul>
 *
 * <p>An invoker that throws despite its contract is treated as a retryable unknown_error attempt.
 * An interrupted backoff ends the loop with an unknown_error failure and restores the interrupt
 * flag.
 *
 * <p>Stateless apart from its collaborators; one instance serves all model tasks concurrently.
 */
public class RetryController {

    private static final Logger LOG = LogManager.getLogger(RetryController.class);

    private final ModelInvokerRegistry registry;
    private final BackoffPolicy backoff;
    private final Sleeper sleeper;
    private final OrchestrationMetricsPublisher metrics;

    public RetryController(ModelInvokerRegistry registry,
                           BackoffPolicy backoff,
                           Sleeper sleeper,
                           OrchestrationMetricsPublisher metrics) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.metrics = metrics == null ? OrchestrationMetricsPublisher.NOOP : metrics;
    }

    public RetryResult runWithRetry(String model, String prompt, long timeoutMs, int maxRetries) {
        return runWithRetry(model, prompt, timeoutMs, maxRetries, null);
    }

    /**
     * @param model      model id; must be resolvable by the registry
     * @param prompt     prompt text
     * @param timeoutMs  per-attempt timeout
     * @param maxRetries retries after the first attempt (0 means exactly one attempt)
     * @param context    run context for attempt accounting (nullable)
     * @return final result for this model
     * @throws com.phillippitts.modelorchestrator.exception.UnsupportedModelException if the model
     *         has no invoker; no attempt is made in that case
     */
    public RetryResult runWithRetry(String model, String prompt, long timeoutMs, int maxRetries, RunContext context) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
        }
        ModelInvoker invoker = registry.resolve(model);
        long start = System.nanoTime();
        List<AttemptRecord> attempts = new ArrayList<>(maxRetries + 1);
        RetryState state = RetryState.PENDING;
        Outcome.Failure lastFailure = null;

        for (int attemptIndex = 0; attemptIndex <= maxRetries; attemptIndex++) {
            long delay = backoff.delayBeforeAttempt(attemptIndex);
            if (delay > 0) {
                state = transition(model, state, RetryState.RETRY_WAIT);
                LOG.info("Retrying {} in {}ms (attempt {}/{})", model, delay, attemptIndex + 1, maxRetries + 1);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    transition(model, state, RetryState.FAILED_TERMINAL);
                    Outcome.Failure interrupted = Outcome.failure(model, ErrorClass.UNKNOWN_ERROR,
                            "Interrupted during backoff", 0);
                    LOG.error("{} interrupted during backoff after {} attempt(s)", model, attempts.size());
                    return finish(RetryResult.failure(model, interrupted, attempts.size(), TimeUtils.elapsedMillis(start)));
                }
            }

            state = transition(model, state, RetryState.ATTEMPTING);
            if (context != null) {
                context.recordAttempt();
            }
            LOG.debug("Attempt {}/{} for {}", attemptIndex + 1, maxRetries + 1, model);
            Outcome outcome = attempt(invoker, new InvocationRequest(model, prompt, timeoutMs));
            attempts.add(new AttemptRecord(attemptIndex, delay, outcome));
            metrics.recordAttempt(outcome);

            if (outcome instanceof Outcome.Success success) {
                transition(model, state, RetryState.SUCCEEDED);
                if (attemptIndex > 0) {
                    LOG.info("{} succeeded on retry (attempt {}/{})", model, attemptIndex + 1, maxRetries + 1);
                }
                return finish(RetryResult.success(model, success, attempts.size(), TimeUtils.elapsedMillis(start)));
            }

            lastFailure = (Outcome.Failure) outcome;
            LOG.warn("Attempt {}/{} for {} failed: {} ({})", attemptIndex + 1, maxRetries + 1, model,
                    lastFailure.errorMessage(), lastFailure.errorClass().wireName());
            if (!lastFailure.errorClass().isRetryable()) {
                transition(model, state, RetryState.FAILED_TERMINAL);
                LOG.error("Non-retryable {} for {}, aborting", lastFailure.errorClass().wireName(), model);
                return finish(RetryResult.failure(model, lastFailure, attempts.size(), TimeUtils.elapsedMillis(start)));
            }
        }

        transition(model, state, RetryState.FAILED_TERMINAL);
        LOG.error("{} failed after {} attempt(s): {}", model, attempts.size(), lastFailure.errorMessage());
        LOG.debug("{} attempt history: {}", model, history(attempts));
        return finish(RetryResult.failure(model, lastFailure, attempts.size(), TimeUtils.elapsedMillis(start)));
    }

    private static String history(List<AttemptRecord> attempts) {
        StringBuilder sb = new StringBuilder();
        for (AttemptRecord attempt : attempts) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append('#').append(attempt.attemptIndex());
            if (attempt.backoffAppliedMs() > 0) {
                sb.append(" (+").append(attempt.backoffAppliedMs()).append("ms)");
            }
            sb.append(' ').append(attempt.outcome() instanceof Outcome.Failure f ? f.errorClass().wireName() : "success");
        }
        return sb.toString();
    }

    private RetryResult finish(RetryResult result) {
        metrics.recordResult(result);
        return result;
    }

    private static Outcome attempt(ModelInvoker invoker, InvocationRequest request) {
        long start = System.nanoTime();
        try {
            Outcome outcome = invoker.invoke(request);
            if (outcome == null) {
                return Outcome.failure(request.model(), ErrorClass.UNKNOWN_ERROR,
                        "Invoker returned no outcome", TimeUtils.elapsedMillis(start));
            }
            return outcome;
        } catch (RuntimeException e) {
            LOG.error("Invoker for {} threw unexpectedly", request.model(), e);
            return Outcome.failure(request.model(), ErrorClass.UNKNOWN_ERROR,
                    e.getClass().getSimpleName() + ": " + e.getMessage(), TimeUtils.elapsedMillis(start));
        }
    }

    private static RetryState transition(String model, RetryState from, RetryState to) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException("Illegal retry transition for " + model + ": " + from + " -> " + to);
        }
        LOG.trace("{}: {} -> {}", model, from, to);
        return to;
    }
}
