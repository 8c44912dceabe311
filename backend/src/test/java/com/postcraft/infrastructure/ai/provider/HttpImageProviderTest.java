package com.postcraft.infrastructure.ai.provider;

import com.postcraft.domain.generation.model.AspectRatio;
import com.postcraft.domain.generation.model.GeneratedImage;
import com.postcraft.domain.generation.model.ProviderRef;
import com.postcraft.domain.generation.model.ReferenceAsset;
import com.postcraft.domain.generation.service.ProviderException;
import com.postcraft.domain.generation.service.ProviderFailure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpImageProviderTest {

    private static final String ENDPOINT = "http://image-proxy.test/generate-image";
    private static final ProviderRef PRIMARY = ProviderRef.of("primary");

    private MockRestServiceServer server;
    private HttpImageProvider provider;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        provider = new HttpImageProvider(PRIMARY, restTemplate, ENDPOINT, "imagen-4", null);
    }

    @Test
    void posts_prompt_and_reads_image_url() {
        server.expect(requestTo(ENDPOINT))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.prompt").value("A loaf of bread"))
                .andExpect(jsonPath("$.aspect_ratio").value("9:16"))
                .andExpect(jsonPath("$.reference_image_url").value("https://cdn.test/logo.png"))
                .andRespond(withSuccess("{\"imageUrl\": \"https://cdn.test/out.png\"}", MediaType.APPLICATION_JSON));

        GeneratedImage image = provider.generate("A loaf of bread", AspectRatio.STORY,
                new ReferenceAsset("https://cdn.test/logo.png"));

        assertThat(image.imageUrl()).isEqualTo("https://cdn.test/out.png");
        assertThat(image.model()).isEqualTo("imagen-4");
        server.verify();
    }

    @Test
    void too_many_requests_is_rate_limited() {
        server.expect(requestTo(ENDPOINT)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertFailure(ProviderFailure.RATE_LIMITED);
    }

    @Test
    void service_unavailable_is_overloaded() {
        server.expect(requestTo(ENDPOINT)).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertFailure(ProviderFailure.OVERLOADED);
    }

    @Test
    void resource_exhausted_body_is_rate_limited() {
        server.expect(requestTo(ENDPOINT)).andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR)
                .body("{\"error\": {\"status\": \"RESOURCE_EXHAUSTED\"}}")
                .contentType(MediaType.APPLICATION_JSON));

        assertFailure(ProviderFailure.RATE_LIMITED);
    }

    @Test
    void bad_request_is_fatal() {
        server.expect(requestTo(ENDPOINT)).andRespond(withStatus(HttpStatus.BAD_REQUEST));

        assertFailure(ProviderFailure.FATAL);
    }

    @Test
    void missing_image_url_is_fatal() {
        server.expect(requestTo(ENDPOINT)).andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        assertFailure(ProviderFailure.FATAL);
    }

    private void assertFailure(ProviderFailure expected) {
        assertThatThrownBy(() -> provider.generate("prompt", AspectRatio.SQUARE, null))
                .isInstanceOfSatisfying(ProviderException.class, e -> {
                    assertThat(e.getFailure()).isEqualTo(expected);
                    assertThat(e.getProvider()).isEqualTo(PRIMARY);
                });
    }
}
