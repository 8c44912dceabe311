package com.postcraft.infrastructure.ai.resilience;

import com.postcraft.domain.generation.exception.GenerationException;
import com.postcraft.domain.generation.model.AttemptOutcome;
import com.postcraft.domain.generation.model.CancellationSignal;
import com.postcraft.domain.generation.model.ErrorKind;
import com.postcraft.domain.generation.model.GenerationAttempt;
import com.postcraft.domain.generation.model.ProviderRef;
import com.postcraft.domain.generation.service.ProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Retry, backoff and failover around a single provider operation.
 * <ul>
 *   <li>rate limited: move to the next provider immediately</li>
 *   <li>overloaded: wait the scheduled delay and retry the same provider</li>
 *   <li>anything else: move to the next provider</li>
 * </ul>
 * Holds no state between calls.
 */
@Slf4j
@Component
public class ResilientProviderCaller {

    private final Sleeper sleeper;
    private final Clock clock;

    @Autowired
    public ResilientProviderCaller(Clock clock) {
        this(Sleeper.threadSleep(), clock);
    }

    public ResilientProviderCaller(Sleeper sleeper, Clock clock) {
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public <T> ProviderCallResult<T> call(List<ProviderRef> providerOrder,
                                          ProviderOperation<T> operation,
                                          int maxAttemptsPerProvider,
                                          BackoffSchedule backoff) {
        return call(providerOrder, operation, maxAttemptsPerProvider, backoff, CancellationSignal.none());
    }

    /**
     * @throws GenerationException {@link ErrorKind#ALL_PROVIDERS_EXHAUSTED} when every provider failed,
     *                             {@link ErrorKind#CANCELLATION_REQUESTED} when cancelled before an attempt
     *                             or interrupted while backing off
     */
    public <T> ProviderCallResult<T> call(List<ProviderRef> providerOrder,
                                          ProviderOperation<T> operation,
                                          int maxAttemptsPerProvider,
                                          BackoffSchedule backoff,
                                          CancellationSignal cancellation) {
        if (providerOrder.isEmpty()) {
            throw new IllegalArgumentException("Provider order must not be empty");
        }
        if (maxAttemptsPerProvider < 1) {
            throw new IllegalArgumentException("maxAttemptsPerProvider must be >= 1: " + maxAttemptsPerProvider);
        }

        List<GenerationAttempt> attempts = new ArrayList<>();
        for (ProviderRef provider : providerOrder) {
            for (int attempt = 0; attempt < maxAttemptsPerProvider; attempt++) {
                if (cancellation.isCancelled()) {
                    throw new GenerationException(ErrorKind.CANCELLATION_REQUESTED,
                            "Cancelled before attempt on " + provider, attempts);
                }

                Instant startedAt = clock.instant();
                try {
                    T value = operation.execute(provider);
                    attempts.add(attempt(attempts, provider, startedAt, AttemptOutcome.SUCCESS));
                    if (attempts.size() > 1) {
                        log.info("[Resilience] Succeeded on {} after {} attempts", provider, attempts.size());
                    }
                    return new ProviderCallResult<>(value, provider, attempts);
                } catch (ProviderException e) {
                    switch (e.getFailure()) {
                        case RATE_LIMITED -> {
                            attempts.add(attempt(attempts, provider, startedAt, AttemptOutcome.RETRYABLE_ERROR));
                            log.warn("[Resilience] {} rate limited, failing over: {}", provider, e.getMessage());
                        }
                        case OVERLOADED -> {
                            attempts.add(attempt(attempts, provider, startedAt, AttemptOutcome.RETRYABLE_ERROR));
                            if (attempt + 1 < maxAttemptsPerProvider) {
                                Duration delay = backoff.delayFor(attempt);
                                log.warn("[Resilience] {} overloaded (attempt {}/{}), retrying in {}ms",
                                        provider, attempt + 1, maxAttemptsPerProvider, delay.toMillis());
                                backOff(delay, provider, attempts);
                                continue;
                            }
                            log.warn("[Resilience] {} still overloaded after {} attempts, failing over",
                                    provider, maxAttemptsPerProvider);
                        }
                        case FATAL -> {
                            attempts.add(attempt(attempts, provider, startedAt, AttemptOutcome.FATAL_ERROR));
                            log.warn("[Resilience] {} failed, failing over: {}", provider, e.getMessage());
                        }
                    }
                    break;
                } catch (GenerationException e) {
                    throw e;
                } catch (RuntimeException e) {
                    attempts.add(attempt(attempts, provider, startedAt, AttemptOutcome.FATAL_ERROR));
                    log.error("[Resilience] Unexpected error from {}, failing over", provider, e);
                    break;
                }
            }
        }

        log.error("[Resilience] All providers exhausted after {} attempts: {}", attempts.size(), providerOrder);
        throw new GenerationException(ErrorKind.ALL_PROVIDERS_EXHAUSTED,
                "All providers exhausted: " + providerOrder, attempts);
    }

    private GenerationAttempt attempt(List<GenerationAttempt> previous, ProviderRef provider,
                                      Instant startedAt, AttemptOutcome outcome) {
        return new GenerationAttempt(previous.size() + 1, provider, startedAt, clock.instant(), outcome);
    }

    private void backOff(Duration delay, ProviderRef provider, List<GenerationAttempt> attempts) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException(ErrorKind.CANCELLATION_REQUESTED,
                    "Interrupted while backing off from " + provider, attempts);
        }
    }
}
