package com.postcraft.domain.generation.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Transient record of a single provider call. Logged, never persisted.
 */
public record GenerationAttempt(
        int attemptNumber,
        ProviderRef provider,
        Instant startedAt,
        Instant endedAt,
        AttemptOutcome outcome
) {
    public Duration elapsed() {
        return Duration.between(startedAt, endedAt);
    }
}
