package com.example.flowmutator.llm;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Builds a {@link ChatModel} for OpenRouter (OpenAI-compatible API).
 * <p>
 * The API key is read from config/env only. A missing key does not stop the application,
 * since mutation, validation and diff never call the model; {@link #build} fails instead.
 * </p>
 */
@Component
public class OpenRouterChatModelFactory {

    static final String DEFAULT_BASE_URL = "https://openrouter.ai/api/v1";
    static final String DEFAULT_MODEL = "openai/gpt-4o-mini";

    private final String apiKey;
    private final String defaultBaseUrl;
    private final String defaultModel;
    private final Duration timeout;

    public OpenRouterChatModelFactory(
            @Value("${openrouter.api-key:}") String apiKey,
            @Value("${openrouter.base-url:" + DEFAULT_BASE_URL + "}") String defaultBaseUrl,
            @Value("${openrouter.model:" + DEFAULT_MODEL + "}") String defaultModel,
            @Value("${openrouter.timeout-seconds:120}") long timeoutSeconds) {
        this.apiKey = apiKey != null ? apiKey.trim() : "";
        this.defaultBaseUrl = defaultBaseUrl != null && !defaultBaseUrl.isBlank() ? defaultBaseUrl.trim() : DEFAULT_BASE_URL;
        this.defaultModel = defaultModel != null && !defaultModel.isBlank() ? defaultModel.trim() : DEFAULT_MODEL;
        this.timeout = Duration.ofSeconds(timeoutSeconds > 0 ? timeoutSeconds : 120);
    }

    public boolean isConfigured() {
        return !apiKey.isEmpty();
    }

    /**
     * Builds a ChatModel using the given base URL and model name.
     * If either is null or blank, the configured default is used.
     */
    public ChatModel build(String baseUrl, String modelName) {
        return build(baseUrl, modelName, null, null);
    }

    /**
     * Same as {@link #build(String, String)} with optional sampling temperature and
     * response token limit; nulls leave the provider defaults in place.
     */
    public ChatModel build(String baseUrl, String modelName, Double temperature, Integer maxTokens) {
        if (!isConfigured()) {
            throw new IllegalStateException(
                    "OpenRouter API key is required. Set OPENROUTER_API_KEY in the environment or openrouter.api-key in configuration.");
        }
        String url = (baseUrl != null && !baseUrl.isBlank()) ? baseUrl.trim() : defaultBaseUrl;
        String model = (modelName != null && !modelName.isBlank()) ? modelName.trim() : defaultModel;
        OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
                .apiKey(apiKey)
                .baseUrl(url)
                .modelName(model)
                .timeout(timeout);
        if (temperature != null) {
            builder.temperature(temperature);
        }
        if (maxTokens != null) {
            builder.maxTokens(maxTokens);
        }
        return builder.build();
    }
}
