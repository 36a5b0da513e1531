package com.phillippitts.modelorchestrator.service.invoker;

import com.phillippitts.modelorchestrator.domain.ErrorClass;
import com.phillippitts.modelorchestrator.domain.InvocationRequest;
import com.phillippitts.modelorchestrator.domain.Outcome;
import com.phillippitts.modelorchestrator.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.task.AsyncTaskExecutor;

import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Enforces the per-attempt timeout around any {@link ModelInvoker}.
 *
 * <p>The delegate runs on the invoker executor; the calling thread waits at most
 * {@code request.timeoutMs()}. On expiry the task is cancelled with interruption and the attempt
 * is reported as timeout_error. The guard also restores the never-throw contract for delegates
 * that break it:
 * <ul>
 *   <li>delegate threw or returned null: unknown_error</li>
 *   <li>invoker executor saturated: rate_limit_error</li>
 * </ul>
 */
public class TimeoutGuardedInvoker implements ModelInvoker {

    private static final Logger LOG = LogManager.getLogger(TimeoutGuardedInvoker.class);

    private final ModelInvoker delegate;
    private final AsyncTaskExecutor executor;

    public TimeoutGuardedInvoker(ModelInvoker delegate, AsyncTaskExecutor executor) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public String modelName() {
        return delegate.modelName();
    }

    @Override
    public boolean isReady() {
        return delegate.isReady();
    }

    @Override
    public Outcome invoke(InvocationRequest request) {
        long start = System.nanoTime();
        Future<Outcome> future;
        try {
            future = executor.submit(() -> delegate.invoke(request));
        } catch (RejectedExecutionException e) {
            LOG.warn("Invoker pool saturated, rejecting attempt for {}", request.model());
            return Outcome.failure(request.model(), ErrorClass.RATE_LIMIT_ERROR,
                    "Invoker pool saturated", TimeUtils.elapsedMillis(start));
        }

        try {
            Outcome outcome = future.get(request.timeoutMs(), TimeUnit.MILLISECONDS);
            if (outcome == null) {
                return Outcome.failure(request.model(), ErrorClass.UNKNOWN_ERROR,
                        "Invoker returned no outcome", TimeUtils.elapsedMillis(start));
            }
            return outcome;
        } catch (TimeoutException e) {
            future.cancel(true);
            return Outcome.failure(request.model(), ErrorClass.TIMEOUT_ERROR,
                    "Timed out after " + request.timeoutMs() + "ms", TimeUtils.elapsedMillis(start));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOG.warn("Invoker for {} threw {}", request.model(), cause.toString());
            return Outcome.failure(request.model(), ErrorClass.UNKNOWN_ERROR,
                    cause.getClass().getSimpleName() + ": " + cause.getMessage(), TimeUtils.elapsedMillis(start));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return Outcome.failure(request.model(), ErrorClass.UNKNOWN_ERROR,
                    "Interrupted while waiting for " + request.model(), TimeUtils.elapsedMillis(start));
        }
    }
}
