package com.postcraft.infrastructure.ai.resilience;

import com.postcraft.domain.generation.model.GenerationAttempt;
import com.postcraft.domain.generation.model.ProviderRef;

import java.util.List;

/**
 * Successful wrapped call.
 *
 * @param value    the operation's result
 * @param provider provider that produced it
 * @param attempts every attempt made, the successful one last
 */
public record ProviderCallResult<T>(T value, ProviderRef provider, List<GenerationAttempt> attempts) {

    public ProviderCallResult {
        attempts = List.copyOf(attempts);
    }

    public boolean failedOver() {
        return attempts.stream().map(GenerationAttempt::provider).distinct().count() > 1;
    }
}
