package com.phillippitts.modelorchestrator.service.invoker;

import com.phillippitts.modelorchestrator.domain.ErrorClass;
import com.phillippitts.modelorchestrator.domain.InvocationRequest;
import com.phillippitts.modelorchestrator.domain.Outcome;
import com.phillippitts.modelorchestrator.util.TimeUtils;

import java.util.Objects;

/**
 * Applies a {@link ConcurrencyGuard} in front of a delegate. An attempt that cannot obtain a
 * permit fails with rate_limit_error and is retried by the retry loop like a provider 429.
 */
public class ConcurrencyLimitedInvoker implements ModelInvoker {

    private final ModelInvoker delegate;
    private final ConcurrencyGuard guard;

    public ConcurrencyLimitedInvoker(ModelInvoker delegate, ConcurrencyGuard guard) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.guard = Objects.requireNonNull(guard, "guard");
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
        try {
            if (!guard.tryAcquire()) {
                return Outcome.failure(request.model(), ErrorClass.RATE_LIMIT_ERROR,
                        request.model() + " concurrency limit reached after " + guard.getTimeoutMs() + "ms wait",
                        TimeUtils.elapsedMillis(start));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.failure(request.model(), ErrorClass.UNKNOWN_ERROR,
                    "Interrupted while waiting for a " + request.model() + " permit", TimeUtils.elapsedMillis(start));
        }
        try {
            return delegate.invoke(request);
        } finally {
            guard.release();
        }
    }
}
