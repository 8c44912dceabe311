package com.postcraft.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * Provider endpoints and credentials, keyed by provider name. Each provider is its own rate-limit domain.
 */
@ConfigurationProperties(prefix = "providers")
public record ProviderProperties(Map<String, Provider> definitions, double temperature, int maxTokens) {

    public ProviderProperties {
        if (definitions == null) definitions = Map.of();
        if (temperature <= 0) temperature = 0.8;
        if (maxTokens <= 0) maxTokens = 800;
    }

    /**
     * @param baseUrl     OpenAI-compatible API root for text
     * @param apiKey      text API key
     * @param textModel   chat model name
     * @param imageUrl    image proxy endpoint
     * @param imageModel  image model name sent to the proxy
     * @param imageApiKey bearer token for the image proxy, optional
     * @param timeout     per-call timeout
     */
    public record Provider(
            String baseUrl,
            String apiKey,
            String textModel,
            String imageUrl,
            String imageModel,
            String imageApiKey,
            Duration timeout
    ) {
        public Provider {
            if (baseUrl == null || baseUrl.isBlank()) baseUrl = "https://api.openai.com/v1";
            if (textModel == null || textModel.isBlank()) textModel = "gpt-4o-mini";
            if (timeout == null) timeout = Duration.ofSeconds(60);
        }
    }
}
