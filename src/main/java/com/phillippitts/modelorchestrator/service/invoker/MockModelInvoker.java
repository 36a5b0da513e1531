package com.phillippitts.modelorchestrator.service.invoker;

import com.phillippitts.modelorchestrator.config.properties.MockModelProperties;
import com.phillippitts.modelorchestrator.domain.ErrorClass;
import com.phillippitts.modelorchestrator.domain.InvocationRequest;
import com.phillippitts.modelorchestrator.domain.Outcome;
import com.phillippitts.modelorchestrator.util.LogSanitizer;
import com.phillippitts.modelorchestrator.util.Sleeper;
import com.phillippitts.modelorchestrator.util.TimeUtils;

import java.util.Objects;
import java.util.Random;

/**
 * In-process stand-in for a remote model. Sleeps a random latency, then either answers with a
 * canned echo of the prompt or fails with rate_limit_error at the configured rate.
 *
 * <p>Used for local runs without credentials and for end-to-end tests.
 */
public class MockModelInvoker implements ModelInvoker {

    static final int PROMPT_PREVIEW_CHARS = 50;
    /** Share of the attempt timeout the simulated latency may use, so mocks never trip the timeout guard. */
    static final double LATENCY_SHARE_OF_TIMEOUT = 0.8;

    private final String modelName;
    private final MockModelProperties properties;
    private final Random random;
    private final Sleeper sleeper;

    public MockModelInvoker(String modelName, MockModelProperties properties, Random random, Sleeper sleeper) {
        this.modelName = Objects.requireNonNull(modelName, "modelName");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.random = Objects.requireNonNull(random, "random");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override
    public String modelName() {
        return modelName;
    }

    @Override
    public Outcome invoke(InvocationRequest request) {
        long start = System.nanoTime();
        long bound = Math.min(properties.maxLatencyMs(), (long) (request.timeoutMs() * LATENCY_SHARE_OF_TIMEOUT));
        long latency = bound <= 0 ? 0 : (long) (random.nextDouble() * bound);
        try {
            sleeper.sleep(latency);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.failure(modelName, ErrorClass.UNKNOWN_ERROR, "Interrupted", TimeUtils.elapsedMillis(start));
        }
        if (random.nextDouble() < properties.failureRate()) {
            return Outcome.failure(modelName, ErrorClass.RATE_LIMIT_ERROR, "Simulated rate limit",
                    TimeUtils.elapsedMillis(start));
        }
        String output = "[MOCK " + modelName + "] Response to: \""
                + LogSanitizer.truncate(request.prompt(), PROMPT_PREVIEW_CHARS) + "...\"";
        return Outcome.success(modelName, output, TimeUtils.elapsedMillis(start));
    }
}
