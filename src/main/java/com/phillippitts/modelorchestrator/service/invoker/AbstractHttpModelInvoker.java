package com.phillippitts.modelorchestrator.service.invoker;

import com.phillippitts.modelorchestrator.config.properties.ModelApiProperties;
import com.phillippitts.modelorchestrator.domain.ErrorClass;
import com.phillippitts.modelorchestrator.domain.InvocationRequest;
import com.phillippitts.modelorchestrator.domain.Outcome;
import com.phillippitts.modelorchestrator.exception.ModelInvocationException;
import com.phillippitts.modelorchestrator.exception.ModelInvocationExceptionBuilder;
import com.phillippitts.modelorchestrator.util.LogSanitizer;
import com.phillippitts.modelorchestrator.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Objects;

/**
 * Base class for invokers that call a JSON-over-HTTP model API.
 *
 * <p>Implements the never-throw contract of {@link ModelInvoker} as a template method: subclasses
 * only build the request body, set provider headers and extract the generated text. Everything
 * else is handled here:
 * <ul>
 *   <li>a blank API key fails with auth_error without a network call</li>
 *   <li>HTTP error statuses are classified from status code and provider error body</li>
 *   <li>I/O problems are classified from the exception chain (socket timeouts become timeout_error)</li>
 *   <li>unexpected response shapes become unknown_error</li>
 * </ul>
 *
 * <p>No retries happen here; a single call is one attempt. The per-attempt timeout is enforced by
 * {@link TimeoutGuardedInvoker}.
 */
public abstract class AbstractHttpModelInvoker implements ModelInvoker {

    private static final Logger LOG = LogManager.getLogger(AbstractHttpModelInvoker.class);
    private static final int ERROR_BODY_PREVIEW = 200;

    private final ModelBackend backend;
    private final ModelApiProperties.Backend endpoint;
    protected final ModelApiProperties api;
    private final RestClient restClient;

    protected AbstractHttpModelInvoker(ModelBackend backend,
                                       ModelApiProperties api,
                                       ModelApiProperties.Backend endpoint,
                                       RestClient.Builder restClientBuilder) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.api = Objects.requireNonNull(api, "api");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.restClient = restClientBuilder.build();
    }

    @Override
    public final String modelName() {
        return backend.id();
    }

    @Override
    public boolean isReady() {
        return endpoint.hasApiKey();
    }

    @Override
    public final Outcome invoke(InvocationRequest request) {
        long start = System.nanoTime();
        if (!endpoint.hasApiKey()) {
            return Outcome.failure(modelName(), ErrorClass.AUTH_ERROR,
                    "No API key configured for " + modelName(), 0);
        }
        try {
            String body = restClient.post()
                    .uri(endpoint.getUrl())
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .headers(headers -> applyHeaders(headers, endpoint.getApiKey()))
                    .body(buildRequestBody(request.prompt(), endpoint.getModel()).toString())
                    .retrieve()
                    .body(String.class);
            if (body == null || body.isBlank()) {
                throw ModelInvocationExceptionBuilder.create("Empty response body")
                        .model(modelName())
                        .build();
            }
            String output = extractOutput(new JSONObject(body));
            if (output == null || output.isBlank()) {
                throw ModelInvocationExceptionBuilder.create("Empty output")
                        .model(modelName())
                        .build();
            }
            long durationMs = TimeUtils.elapsedMillis(start);
            LOG.debug("{} answered in {}ms ({} chars)", modelName(), durationMs, output.length());
            return Outcome.success(modelName(), output, durationMs);
        } catch (RestClientResponseException e) {
            return failureFromHttpError(e, TimeUtils.elapsedMillis(start));
        } catch (ResourceAccessException e) {
            ErrorClass errorClass = ErrorClassifier.classify(e);
            return Outcome.failure(modelName(), errorClass, "I/O error: " + e.getMessage(),
                    TimeUtils.elapsedMillis(start));
        } catch (ModelInvocationException e) {
            return Outcome.failure(modelName(), e.getErrorClass(), e.getMessage(), TimeUtils.elapsedMillis(start));
        } catch (JSONException e) {
            return Outcome.failure(modelName(), ErrorClass.UNKNOWN_ERROR,
                    "Unparseable response: " + e.getMessage(), TimeUtils.elapsedMillis(start));
        } catch (RestClientException | IllegalArgumentException | IllegalStateException e) {
            return Outcome.failure(modelName(), ErrorClassifier.classify(e),
                    e.getClass().getSimpleName() + ": " + e.getMessage(), TimeUtils.elapsedMillis(start));
        }
    }

    private Outcome failureFromHttpError(RestClientResponseException e, long durationMs) {
        int status = e.getStatusCode().value();
        String raw = e.getResponseBodyAsString();
        String providerType = null;
        String providerMessage = null;
        try {
            JSONObject json = new JSONObject(raw);
            JSONObject error = json.optJSONObject("error");
            if (error != null) {
                providerType = error.optString("type", error.optString("status", null));
                providerMessage = error.optString("message", null);
            }
        } catch (JSONException notJson) {
            // non-JSON error pages (proxies, gateways) fall back to the raw body preview
            providerMessage = LogSanitizer.truncate(raw, ERROR_BODY_PREVIEW);
        }
        ErrorClass errorClass = ErrorClassifier.classify(status, providerType, providerMessage);
        String message = "HTTP " + status
                + (providerMessage == null || providerMessage.isBlank() ? "" : ": " + providerMessage);
        return Outcome.failure(modelName(), errorClass, message, durationMs);
    }

    /**
     * Reads {@code array[0]} or fails with an unknown_error naming the missing path.
     */
    protected final JSONObject firstElement(JSONObject parent, String arrayField) {
        JSONArray array = parent.optJSONArray(arrayField);
        if (array == null || array.isEmpty() || array.optJSONObject(0) == null) {
            throw unexpectedShape(arrayField + "[0]");
        }
        return array.getJSONObject(0);
    }

    protected final String requiredString(JSONObject parent, String field, String path) {
        if (!parent.has(field) || parent.isNull(field)) {
            throw unexpectedShape(path);
        }
        return parent.getString(field);
    }

    protected final ModelInvocationException unexpectedShape(String path) {
        return ModelInvocationExceptionBuilder.create("Unexpected response shape")
                .model(modelName())
                .errorClass(ErrorClass.UNKNOWN_ERROR)
                .metadata("missing", path)
                .build();
    }

    /**
     * Sets authentication and version headers. Content type and accept are already set.
     */
    protected abstract void applyHeaders(HttpHeaders headers, String apiKey);

    protected abstract JSONObject buildRequestBody(String prompt, String providerModel);

    /**
     * Extracts the generated text from a successful response.
     *
     * @throws ModelInvocationException when the body does not have the expected shape or reports an error
     */
    protected abstract String extractOutput(JSONObject response);
}
