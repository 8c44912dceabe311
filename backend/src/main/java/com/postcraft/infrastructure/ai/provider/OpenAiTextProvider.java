package com.postcraft.infrastructure.ai.provider;

import com.openai.client.OpenAIClient;
import com.openai.errors.OpenAIException;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;
import com.openai.models.ResponseFormatJsonObject;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.postcraft.domain.generation.model.ProviderRef;
import com.postcraft.domain.generation.service.ProviderException;
import com.postcraft.domain.generation.service.ProviderFailure;
import com.postcraft.domain.generation.service.TextProvider;
import com.postcraft.infrastructure.ai.GenerationMetricsTracker;
import lombok.extern.slf4j.Slf4j;

/**
 * Chat-completions text provider for any OpenAI-compatible endpoint.
 * SDK retries are disabled; retry policy belongs to the resilience wrapper.
 */
@Slf4j
public class OpenAiTextProvider implements TextProvider {

    static final String SYSTEM_PROMPT =
            "You are an expert social media copywriter for small businesses. " +
            "You write short, specific, on-brand posts in clear English and always answer with JSON only.";

    private final ProviderRef ref;
    private final OpenAIClient openAIClient;
    private final String model;
    private final double temperature;
    private final int maxTokens;
    private final GenerationMetricsTracker metrics;

    public OpenAiTextProvider(ProviderRef ref, OpenAIClient openAIClient, String model,
                              double temperature, int maxTokens, GenerationMetricsTracker metrics) {
        this.ref = ref;
        this.openAIClient = openAIClient;
        this.model = model;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.metrics = metrics;
    }

    @Override
    public ProviderRef ref() {
        return ref;
    }

    @Override
    public String generate(String prompt) {
        ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                .model(model)
                .temperature(temperature)
                .maxCompletionTokens(maxTokens)
                .addSystemMessage(SYSTEM_PROMPT)
                .addUserMessage(prompt)
                .responseFormat(ResponseFormatJsonObject.builder().build())
                .build();

        ChatCompletion completion;
        try {
            completion = openAIClient.chat().completions().create(params);
        } catch (OpenAIException e) {
            throw classify(e);
        }

        completion.usage().ifPresent(usage -> {
            log.info("Token usage [{}:{}] - prompt: {}, completion: {}, total: {}",
                    ref, model, usage.promptTokens(), usage.completionTokens(), usage.totalTokens());
            metrics.recordTokens(usage.promptTokens(), usage.completionTokens());
        });

        return completion.choices().stream()
                .findFirst()
                .flatMap(choice -> choice.message().content())
                .map(String::trim)
                .filter(content -> !content.isEmpty())
                .orElseThrow(() -> ProviderException.fatal(ref, "Text response from " + ref + " had no content"));
    }

    private ProviderException classify(OpenAIException e) {
        ProviderFailure failure;
        if (e instanceof OpenAIServiceException serviceException) {
            failure = failureForStatus(serviceException.statusCode());
        } else if (e instanceof OpenAIIoException) {
            failure = ProviderFailure.OVERLOADED;
        } else {
            failure = ProviderFailure.FATAL;
        }
        log.warn("Text call to {} [{}] failed ({}): {}", ref, model, failure, e.getMessage());
        return new ProviderException(ref, failure, "Text provider " + ref + " failed: " + e.getMessage(), e);
    }

    static ProviderFailure failureForStatus(int status) {
        if (status == 429) {
            return ProviderFailure.RATE_LIMITED;
        }
        if (status == 502 || status == 503 || status == 504 || status == 529) {
            return ProviderFailure.OVERLOADED;
        }
        return ProviderFailure.FATAL;
    }
}
