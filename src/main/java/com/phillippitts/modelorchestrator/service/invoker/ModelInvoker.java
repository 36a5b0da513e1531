package com.phillippitts.modelorchestrator.service.invoker;

import com.phillippitts.modelorchestrator.domain.InvocationRequest;
import com.phillippitts.modelorchestrator.domain.Outcome;

/**
 * One backend family able to answer a prompt.
 *
 * <p>Contract: {@link #invoke(InvocationRequest)} never throws. Every failure, timeouts
 * included, is returned as an {@link Outcome.Failure} carrying a classified error. Callers still
 * guard against misbehaving implementations and treat a thrown exception as unknown_error.
 */
public interface ModelInvoker {

    /**
     * Runs a single attempt.
     *
     * @param request model, prompt and per-attempt timeout
     * @return success with output, or a classified failure
     */
    Outcome invoke(InvocationRequest request);

    /**
     * @return model identifier this invoker answers for (e.g. "claude")
     */
    String modelName();

    /**
     * Whether the backend is usable without a network round trip (e.g. credentials present).
     * Used for health reporting only; an unready invoker is still invoked and fails with a
     * classified error.
     */
    default boolean isReady() {
        return true;
    }
}
