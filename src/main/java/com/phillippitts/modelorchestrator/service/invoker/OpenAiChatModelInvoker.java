package com.phillippitts.modelorchestrator.service.invoker;

import com.phillippitts.modelorchestrator.config.properties.ModelApiProperties;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClient;

/**
 * OpenAI chat completions endpoint, serving the {@code gpt4} model id.
 */
public class OpenAiChatModelInvoker extends AbstractHttpModelInvoker {

    public OpenAiChatModelInvoker(ModelApiProperties api, RestClient.Builder restClientBuilder) {
        super(ModelBackend.GPT4, api, api.getGpt4(), restClientBuilder);
    }

    @Override
    protected void applyHeaders(HttpHeaders headers, String apiKey) {
        headers.setBearerAuth(apiKey);
    }

    @Override
    protected JSONObject buildRequestBody(String prompt, String providerModel) {
        JSONObject message = new JSONObject().put("role", "user").put("content", prompt);
        return new JSONObject()
                .put("model", providerModel)
                .put("messages", new JSONArray().put(message))
                .put("max_tokens", api.getMaxTokens())
                .put("temperature", api.getTemperature());
    }

    @Override
    protected String extractOutput(JSONObject response) {
        JSONObject message = firstElement(response, "choices").optJSONObject("message");
        if (message == null) {
            throw unexpectedShape("choices[0].message");
        }
        return requiredString(message, "content", "choices[0].message.content");
    }
}
