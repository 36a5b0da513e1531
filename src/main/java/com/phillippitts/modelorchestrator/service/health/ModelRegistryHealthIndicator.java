package com.phillippitts.modelorchestrator.service.health;

import com.phillippitts.modelorchestrator.service.invoker.ModelInvokerRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Health of the registered model backends.
 *
 * <ul>
 *   <li>UP: every backend ready (mock mode, or API key configured)</li>
 *   <li>DEGRADED: at least one backend ready</li>
 *   <li>DOWN: no backend ready</li>
 * </ul>
 *
 * <p>Readiness is checked locally; no provider is contacted. Exposed via /actuator/health.
 */
@Component
public class ModelRegistryHealthIndicator implements HealthIndicator {

    private final ModelInvokerRegistry registry;

    public ModelRegistryHealthIndicator(ModelInvokerRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        Map<String, Boolean> readiness = registry.readiness();
        long ready = readiness.values().stream().filter(Boolean::booleanValue).count();

        Health.Builder builder = new Health.Builder();
        if (!readiness.isEmpty() && ready == readiness.size()) {
            builder.up().withDetail("status", "All models ready");
        } else if (ready > 0) {
            builder.status("DEGRADED").withDetail("status", "Partial model availability");
        } else {
            builder.down().withDetail("status", "No models available");
        }
        readiness.forEach((model, isReady) -> builder.withDetail(model, isReady ? "ready" : "missing-api-key"));
        return builder.build();
    }
}
