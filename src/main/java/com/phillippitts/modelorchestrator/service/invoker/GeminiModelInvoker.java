package com.phillippitts.modelorchestrator.service.invoker;

import com.phillippitts.modelorchestrator.config.properties.ModelApiProperties;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClient;

/**
 * Google Generative Language API ({@code models/*:generateContent}).
 *
 * <p>The key is sent in the {@code x-goog-api-key} header so it never appears in a logged URL.
 */
public class GeminiModelInvoker extends AbstractHttpModelInvoker {

    public GeminiModelInvoker(ModelApiProperties api, RestClient.Builder restClientBuilder) {
        super(ModelBackend.GEMINI, api, api.getGemini(), restClientBuilder);
    }

    @Override
    protected void applyHeaders(HttpHeaders headers, String apiKey) {
        headers.set("x-goog-api-key", apiKey);
    }

    @Override
    protected JSONObject buildRequestBody(String prompt, String providerModel) {
        JSONObject part = new JSONObject().put("text", prompt);
        JSONObject content = new JSONObject().put("parts", new JSONArray().put(part));
        JSONObject generationConfig = new JSONObject()
                .put("temperature", api.getTemperature())
                .put("maxOutputTokens", api.getMaxTokens());
        return new JSONObject()
                .put("contents", new JSONArray().put(content))
                .put("generationConfig", generationConfig);
    }

    @Override
    protected String extractOutput(JSONObject response) {
        JSONObject candidate = firstElement(response, "candidates");
        JSONObject content = candidate.optJSONObject("content");
        if (content == null) {
            throw unexpectedShape("candidates[0].content");
        }
        return requiredString(firstElement(content, "parts"), "text", "candidates[0].content.parts[0].text");
    }
}
