package com.postcraft.infrastructure.ai.provider;

import com.postcraft.domain.generation.service.ProviderFailure;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OpenAiTextProviderTest {

    @Test
    void status_codes_map_to_failure_classes() {
        assertThat(OpenAiTextProvider.failureForStatus(429)).isEqualTo(ProviderFailure.RATE_LIMITED);
        assertThat(OpenAiTextProvider.failureForStatus(503)).isEqualTo(ProviderFailure.OVERLOADED);
        assertThat(OpenAiTextProvider.failureForStatus(502)).isEqualTo(ProviderFailure.OVERLOADED);
        assertThat(OpenAiTextProvider.failureForStatus(529)).isEqualTo(ProviderFailure.OVERLOADED);
        assertThat(OpenAiTextProvider.failureForStatus(400)).isEqualTo(ProviderFailure.FATAL);
        assertThat(OpenAiTextProvider.failureForStatus(401)).isEqualTo(ProviderFailure.FATAL);
        assertThat(OpenAiTextProvider.failureForStatus(500)).isEqualTo(ProviderFailure.FATAL);
    }
}
