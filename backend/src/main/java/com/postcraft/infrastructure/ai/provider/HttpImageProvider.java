package com.postcraft.infrastructure.ai.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.postcraft.domain.generation.model.AspectRatio;
import com.postcraft.domain.generation.model.GeneratedImage;
import com.postcraft.domain.generation.model.ProviderRef;
import com.postcraft.domain.generation.model.ReferenceAsset;
import com.postcraft.domain.generation.service.ImageProvider;
import com.postcraft.domain.generation.service.ProviderException;
import com.postcraft.domain.generation.service.ProviderFailure;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Image provider behind an HTTP proxy: POST {prompt, model, aspect_ratio, reference_image_url}, answer {imageUrl}.
 */
@Slf4j
public class HttpImageProvider implements ImageProvider {

    private final ProviderRef ref;
    private final RestTemplate restTemplate;
    private final String endpoint;
    private final String model;
    private final String apiKey;

    public HttpImageProvider(ProviderRef ref, RestTemplate restTemplate, String endpoint, String model, String apiKey) {
        this.ref = ref;
        this.restTemplate = restTemplate;
        this.endpoint = endpoint;
        this.model = model;
        this.apiKey = apiKey;
    }

    @Override
    public ProviderRef ref() {
        return ref;
    }

    @Override
    public GeneratedImage generate(String prompt, AspectRatio aspectRatio, ReferenceAsset reference) {
        if (endpoint == null || endpoint.isBlank()) {
            throw ProviderException.fatal(ref, "Image endpoint for " + ref + " is not configured");
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("prompt", prompt);
        body.put("model", model);
        body.put("aspect_ratio", aspectRatio.label());
        if (reference != null) {
            body.put("reference_image_url", reference.url());
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (apiKey != null && !apiKey.isBlank()) {
            headers.setBearerAuth(apiKey);
        }

        JsonNode response;
        try {
            response = restTemplate.postForObject(endpoint, new HttpEntity<>(body, headers), JsonNode.class);
        } catch (HttpClientErrorException.TooManyRequests e) {
            throw ProviderException.rateLimited(ref, "Image provider " + ref + " rate limited");
        } catch (HttpServerErrorException e) {
            throw classifyServerError(e);
        } catch (ResourceAccessException e) {
            throw new ProviderException(ref, ProviderFailure.OVERLOADED,
                    "Image provider " + ref + " unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new ProviderException(ref, ProviderFailure.FATAL,
                    "Image provider " + ref + " failed: " + e.getMessage(), e);
        }

        String imageUrl = response == null ? null : firstText(response, "imageUrl", "image_url", "url");
        if (imageUrl == null) {
            throw ProviderException.fatal(ref, "Image response from " + ref + " had no image URL");
        }
        log.debug("Image generated by {} [{}] at {}", ref, model, aspectRatio.label());
        return new GeneratedImage(imageUrl, model);
    }

    private ProviderException classifyServerError(HttpServerErrorException e) {
        int status = e.getStatusCode().value();
        String responseBody = e.getResponseBodyAsString();
        if (responseBody.contains("RESOURCE_EXHAUSTED")) {
            return ProviderException.rateLimited(ref, "Image provider " + ref + " quota exhausted");
        }
        if (status == 502 || status == 503 || status == 504) {
            return ProviderException.overloaded(ref, "Image provider " + ref + " overloaded (" + status + ")");
        }
        return ProviderException.fatal(ref, "Image provider " + ref + " returned " + status);
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.path(field);
            if (value.isTextual() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }
}
