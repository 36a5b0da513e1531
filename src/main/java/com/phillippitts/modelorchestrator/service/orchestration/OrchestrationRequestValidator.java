package com.phillippitts.modelorchestrator.service.orchestration;

import com.phillippitts.modelorchestrator.config.properties.OrchestrationProperties;
import com.phillippitts.modelorchestrator.domain.OrchestrationRequest;
import com.phillippitts.modelorchestrator.exception.InvalidOrchestrationRequestException;
import com.phillippitts.modelorchestrator.service.invoker.ModelInvokerRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Turns raw caller input (CLI flags, REST body) into a normalized {@link OrchestrationRequest}.
 *
 * <ul>
 *   <li>missing values fall back to configured defaults</li>
 *   <li>model ids are trimmed and lower-cased; blank entries are dropped; duplicates are kept</li>
 *   <li>a timeout above the configured maximum is capped, not rejected</li>
 * </ul>
 *
 * @throws InvalidOrchestrationRequestException for a blank prompt, an empty model list, an
 *         unsupported model, a non-positive timeout or negative retries
 */
public class OrchestrationRequestValidator {

    private static final Logger LOG = LogManager.getLogger(OrchestrationRequestValidator.class);

    private final OrchestrationProperties properties;
    private final ModelInvokerRegistry registry;

    public OrchestrationRequestValidator(OrchestrationProperties properties, ModelInvokerRegistry registry) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public OrchestrationRequest validate(List<String> models, String prompt, Long timeoutMs, Integer maxRetries) {
        if (prompt == null || prompt.isBlank()) {
            throw new InvalidOrchestrationRequestException("Prompt must not be empty");
        }

        List<String> normalized = normalizeModels(models == null || models.isEmpty()
                ? properties.getDefaultModels() : models);
        if (normalized.isEmpty()) {
            throw new InvalidOrchestrationRequestException("At least one model is required");
        }
        List<String> unsupported = normalized.stream().filter(m -> !registry.supports(m)).distinct().toList();
        if (!unsupported.isEmpty()) {
            throw new InvalidOrchestrationRequestException("Unsupported model(s): " + String.join(", ", unsupported)
                    + ". Supported: " + String.join(", ", registry.supportedModels()));
        }

        long timeout = timeoutMs == null ? properties.getDefaultTimeoutMs() : timeoutMs;
        if (timeout <= 0) {
            throw new InvalidOrchestrationRequestException("Timeout must be positive, got: " + timeout);
        }
        if (timeout > properties.getMaxTimeoutMs()) {
            LOG.warn("Timeout {}ms exceeds maximum, capping at {}ms", timeout, properties.getMaxTimeoutMs());
            timeout = properties.getMaxTimeoutMs();
        }

        int retries = maxRetries == null ? properties.getDefaultMaxRetries() : maxRetries;
        if (retries < 0) {
            throw new InvalidOrchestrationRequestException("Retries must not be negative, got: " + retries);
        }
        return new OrchestrationRequest(normalized, prompt, timeout, retries);
    }

    private static List<String> normalizeModels(List<String> models) {
        List<String> result = new ArrayList<>(models.size());
        for (String model : models) {
            if (model != null && !model.isBlank()) {
                result.add(model.trim().toLowerCase(Locale.ROOT));
            }
        }
        return result;
    }
}
