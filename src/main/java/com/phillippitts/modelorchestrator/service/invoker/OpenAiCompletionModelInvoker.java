package com.phillippitts.modelorchestrator.service.invoker;

import com.phillippitts.modelorchestrator.config.properties.ModelApiProperties;
import org.json.JSONObject;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClient;

/**
 * OpenAI legacy completions endpoint, serving the {@code codex} model id.
 * Uses a lower temperature than chat models for more deterministic code output.
 */
public class OpenAiCompletionModelInvoker extends AbstractHttpModelInvoker {

    static final double CODE_TEMPERATURE = 0.5;

    public OpenAiCompletionModelInvoker(ModelApiProperties api, RestClient.Builder restClientBuilder) {
        super(ModelBackend.CODEX, api, api.getCodex(), restClientBuilder);
    }

    @Override
    protected void applyHeaders(HttpHeaders headers, String apiKey) {
        headers.setBearerAuth(apiKey);
    }

    @Override
    protected JSONObject buildRequestBody(String prompt, String providerModel) {
        return new JSONObject()
                .put("model", providerModel)
                .put("prompt", prompt)
                .put("max_tokens", api.getMaxTokens())
                .put("temperature", CODE_TEMPERATURE);
    }

    @Override
    protected String extractOutput(JSONObject response) {
        return requiredString(firstElement(response, "choices"), "text", "choices[0].text");
    }
}
