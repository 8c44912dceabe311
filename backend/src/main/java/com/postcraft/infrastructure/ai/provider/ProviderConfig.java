package com.postcraft.infrastructure.ai.provider;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.postcraft.domain.generation.model.ProviderRef;
import com.postcraft.domain.generation.service.ImageProvider;
import com.postcraft.domain.generation.service.TextProvider;
import com.postcraft.infrastructure.ai.GenerationMetricsTracker;
import com.postcraft.infrastructure.config.ProviderProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One OpenAI client and one image client per configured provider.
 */
@Slf4j
@Configuration
public class ProviderConfig {

    @Bean
    public ProviderDirectory providerDirectory(ProviderProperties properties, GenerationMetricsTracker metrics) {
        List<TextProvider> textProviders = new ArrayList<>();
        List<ImageProvider> imageProviders = new ArrayList<>();

        for (Map.Entry<String, ProviderProperties.Provider> entry : properties.definitions().entrySet()) {
            ProviderRef ref = ProviderRef.of(entry.getKey());
            ProviderProperties.Provider provider = entry.getValue();

            OpenAIClient client = OpenAIOkHttpClient.builder()
                    .apiKey(provider.apiKey() == null ? "" : provider.apiKey())
                    .baseUrl(provider.baseUrl())
                    .timeout(provider.timeout())
                    .maxRetries(0)
                    .build();
            textProviders.add(new OpenAiTextProvider(ref, client, provider.textModel(),
                    properties.temperature(), properties.maxTokens(), metrics));
            imageProviders.add(new HttpImageProvider(ref, restTemplate(provider), provider.imageUrl(),
                    provider.imageModel(), provider.imageApiKey()));

            log.info("Provider {} configured (textModel={}, baseUrl={}, imageModel={})",
                    ref, provider.textModel(), provider.baseUrl(), provider.imageModel());
        }
        return new ProviderDirectory(textProviders, imageProviders);
    }

    private static RestTemplate restTemplate(ProviderProperties.Provider provider) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(10000);
        factory.setReadTimeout((int) provider.timeout().toMillis());
        return new RestTemplate(factory);
    }
}
