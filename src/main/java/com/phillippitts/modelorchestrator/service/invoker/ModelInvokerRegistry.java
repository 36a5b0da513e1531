package com.phillippitts.modelorchestrator.service.invoker;

import com.phillippitts.modelorchestrator.exception.UnsupportedModelException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Model identifier to invoker lookup, built once at startup.
 *
 * <p>Identifiers are matched case-insensitively. Immutable after construction and safe for
 * concurrent reads from all model tasks.
 */
public class ModelInvokerRegistry {

    private final Map<String, ModelInvoker> invokers;
    private final List<String> order;

    public ModelInvokerRegistry(Collection<? extends ModelInvoker> invokers) {
        Map<String, ModelInvoker> byName = new LinkedHashMap<>();
        for (ModelInvoker invoker : invokers) {
            String key = normalize(invoker.modelName());
            if (byName.putIfAbsent(key, invoker) != null) {
                throw new IllegalArgumentException("Duplicate invoker for model: " + key);
            }
        }
        this.invokers = Map.copyOf(byName);
        this.order = List.copyOf(byName.keySet());
    }

    /**
     * @throws UnsupportedModelException when no invoker is registered for the id
     */
    public ModelInvoker resolve(String model) {
        ModelInvoker invoker = model == null ? null : invokers.get(normalize(model));
        if (invoker == null) {
            throw new UnsupportedModelException(model);
        }
        return invoker;
    }

    public boolean supports(String model) {
        return model != null && invokers.containsKey(normalize(model));
    }

    /**
     * @return registered ids in registration order
     */
    public List<String> supportedModels() {
        return order;
    }

    /**
     * @return readiness per model id, in registration order
     */
    public Map<String, Boolean> readiness() {
        Map<String, Boolean> result = new LinkedHashMap<>();
        for (String model : order) {
            result.put(model, invokers.get(model).isReady());
        }
        return result;
    }

    private static String normalize(String model) {
        return model.trim().toLowerCase(Locale.ROOT);
    }
}
