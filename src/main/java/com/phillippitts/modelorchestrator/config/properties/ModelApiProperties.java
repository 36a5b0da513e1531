package com.phillippitts.modelorchestrator.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Endpoints, model names and credentials of the remote model APIs.
 *
 * <p>API keys default to the provider's conventional environment variable, e.g.
 * {@code orchestrator.api.claude.api-key=${ANTHROPIC_API_KEY:}}. A blank key makes every
 * attempt against that backend fail with auth_error without a network call.
 */
@ConfigurationProperties(prefix = "orchestrator.api")
public class ModelApiProperties {

    private int maxTokens = 2048;
    private double temperature = 0.7;

    private Backend gemini = new Backend(
            "https://generativelanguage.googleapis.com/v1beta/models/gemini-pro:generateContent", "gemini-pro");
    private Backend gpt4 = new Backend("https://api.openai.com/v1/chat/completions", "gpt-4");
    private Backend codex = new Backend("https://api.openai.com/v1/completions", "code-davinci-002");
    private Backend claude = new Backend("https://api.anthropic.com/v1/messages", "claude-3-opus-20240229");

    /** Sent as the anthropic-version header. */
    private String anthropicVersion = "2023-06-01";

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public Backend getGemini() {
        return gemini;
    }

    public void setGemini(Backend gemini) {
        this.gemini = gemini;
    }

    public Backend getGpt4() {
        return gpt4;
    }

    public void setGpt4(Backend gpt4) {
        this.gpt4 = gpt4;
    }

    public Backend getCodex() {
        return codex;
    }

    public void setCodex(Backend codex) {
        this.codex = codex;
    }

    public Backend getClaude() {
        return claude;
    }

    public void setClaude(Backend claude) {
        this.claude = claude;
    }

    public String getAnthropicVersion() {
        return anthropicVersion;
    }

    public void setAnthropicVersion(String anthropicVersion) {
        this.anthropicVersion = anthropicVersion;
    }

    /**
     * One remote backend.
     */
    public static class Backend {
        private String url;
        private String model;
        private String apiKey = "";

        public Backend() {
        }

        public Backend(String url, String model) {
            this.url = url;
            this.model = model;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }
}
