package com.phillippitts.modelorchestrator.service.events;

import java.time.Instant;
import java.util.Map;

/**
 * Published when an attempt could not obtain a per-model concurrency permit in time.
 *
 * @param model     throttled model
 * @param timestamp when the limit was hit
 * @param message   human-readable reason
 * @param context   additional key/value details
 */
public record ModelThrottledEvent(String model, Instant timestamp, String message, Map<String, String> context) {

    public ModelThrottledEvent {
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
