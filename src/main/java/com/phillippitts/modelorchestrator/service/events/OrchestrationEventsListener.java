package com.phillippitts.modelorchestrator.service.events;

import com.phillippitts.modelorchestrator.domain.FailureSummary;
import com.phillippitts.modelorchestrator.service.orchestration.event.OrchestrationCompletedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns configuration-class failures into actionable warnings. Throttled per model and error
 * class so a misconfigured backend does not flood the log on every run.
 */
@Component
class OrchestrationEventsListener {
    private static final Logger LOG = LogManager.getLogger(OrchestrationEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onOrchestrationCompleted(OrchestrationCompletedEvent e) {
        for (FailureSummary failure : e.summary().failures()) {
            String key = failure.model() + '-' + failure.errorClass().wireName();
            switch (failure.errorClass()) {
                case AUTH_ERROR -> {
                    if (shouldLog(key)) {
                        LOG.warn("{} rejected the credentials. Check orchestrator.api.{}.api-key "
                                + "(or the provider's API key environment variable).", failure.model(), failure.model());
                    }
                }
                case NOT_FOUND_ERROR -> {
                    if (shouldLog(key)) {
                        LOG.warn("{} endpoint or model id not found. Check orchestrator.api.{}.url and .model.",
                                failure.model(), failure.model());
                    }
                }
                case INVALID_REQUEST_ERROR -> {
                    if (shouldLog(key)) {
                        LOG.warn("{} rejected the request as invalid: {}", failure.model(), failure.errorMessage());
                    }
                }
                default -> {
                    // transient classes are already logged per attempt
                }
            }
        }
    }

    @EventListener
    void onModelThrottled(ModelThrottledEvent e) {
        if (shouldLog("throttled-" + e.model())) {
            LOG.warn("{} hit its in-flight limit ({}). Consider raising "
                    + "orchestrator.concurrency.max-in-flight-per-model.", e.model(), e.message());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        boolean[] granted = new boolean[1];
        lastLog.compute(key, (k, prev) -> {
            if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
                granted[0] = true;
                return now;
            }
            return prev;
        });
        return granted[0];
    }
}
