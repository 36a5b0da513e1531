package com.phillippitts.modelorchestrator.service.invoker;

import com.phillippitts.modelorchestrator.config.properties.ModelApiProperties;
import com.phillippitts.modelorchestrator.exception.ModelInvocationExceptionBuilder;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClient;

/**
 * Anthropic Messages API, serving the {@code claude} model id.
 *
 * <p>Anthropic may return an error object ({@code "type": "error"}) with a 200 status when a
 * stream is interrupted; that body is classified by its {@code error.type}.
 */
public class AnthropicModelInvoker extends AbstractHttpModelInvoker {

    public AnthropicModelInvoker(ModelApiProperties api, RestClient.Builder restClientBuilder) {
        super(ModelBackend.CLAUDE, api, api.getClaude(), restClientBuilder);
    }

    @Override
    protected void applyHeaders(HttpHeaders headers, String apiKey) {
        headers.set("x-api-key", apiKey);
        headers.set("anthropic-version", api.getAnthropicVersion());
    }

    @Override
    protected JSONObject buildRequestBody(String prompt, String providerModel) {
        JSONObject message = new JSONObject().put("role", "user").put("content", prompt);
        return new JSONObject()
                .put("model", providerModel)
                .put("max_tokens", api.getMaxTokens())
                .put("temperature", api.getTemperature())
                .put("messages", new JSONArray().put(message));
    }

    @Override
    protected String extractOutput(JSONObject response) {
        if ("error".equals(response.optString("type"))) {
            JSONObject error = response.optJSONObject("error");
            String type = error == null ? null : error.optString("type", null);
            String message = error == null ? "unspecified" : error.optString("message", "unspecified");
            throw ModelInvocationExceptionBuilder.create("Provider error: " + message)
                    .model(modelName())
                    .errorClass(ErrorClassifier.classify(null, type, message))
                    .build();
        }
        return requiredString(firstElement(response, "content"), "text", "content[0].text");
    }
}
