package com.postcraft.infrastructure.ai.resilience;

import com.postcraft.domain.generation.exception.GenerationException;
import com.postcraft.domain.generation.model.AttemptOutcome;
import com.postcraft.domain.generation.model.CancellationSignal;
import com.postcraft.domain.generation.model.ErrorKind;
import com.postcraft.domain.generation.model.GenerationAttempt;
import com.postcraft.domain.generation.model.ProviderRef;
import com.postcraft.domain.generation.service.ProviderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResilientProviderCallerTest {

    private static final ProviderRef PRIMARY = ProviderRef.of("primary");
    private static final ProviderRef SECONDARY = ProviderRef.of("secondary");
    private static final BackoffSchedule BACKOFF = new BackoffSchedule(
            List.of(Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400)));

    private final List<Duration> sleeps = new ArrayList<>();
    private final List<ProviderRef> calls = new ArrayList<>();
    private ResilientProviderCaller caller;

    @BeforeEach
    void setUp() {
        caller = new ResilientProviderCaller(sleeps::add, Clock.systemUTC());
    }

    @Nested
    @DisplayName("Rate limiting")
    class RateLimitTests {
        @Test
        void rate_limited_primary_fails_over_without_sleeping() {
            ProviderCallResult<String> result = caller.call(List.of(PRIMARY, SECONDARY), provider -> {
                calls.add(provider);
                if (provider.equals(PRIMARY)) {
                    throw ProviderException.rateLimited(provider, "429");
                }
                return "ok";
            }, 3, BACKOFF);

            assertThat(result.value()).isEqualTo("ok");
            assertThat(result.provider()).isEqualTo(SECONDARY);
            assertThat(calls).containsExactly(PRIMARY, SECONDARY);
            assertThat(sleeps).isEmpty();
            assertThat(result.failedOver()).isTrue();
            assertThat(result.attempts()).extracting(GenerationAttempt::outcome)
                    .containsExactly(AttemptOutcome.RETRYABLE_ERROR, AttemptOutcome.SUCCESS);
        }
    }

    @Nested
    @DisplayName("Overload backoff")
    class OverloadTests {
        @Test
        void overloaded_provider_is_retried_with_schedule() {
            ProviderCallResult<String> result = caller.call(List.of(PRIMARY, SECONDARY), provider -> {
                calls.add(provider);
                if (calls.size() < 3) {
                    throw ProviderException.overloaded(provider, "503");
                }
                return "ok";
            }, 3, BACKOFF);

            assertThat(result.provider()).isEqualTo(PRIMARY);
            assertThat(calls).containsExactly(PRIMARY, PRIMARY, PRIMARY);
            assertThat(sleeps).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
            assertThat(result.failedOver()).isFalse();
        }

        @Test
        void persistent_overload_moves_on_after_max_attempts() {
            ProviderCallResult<String> result = caller.call(List.of(PRIMARY, SECONDARY), provider -> {
                calls.add(provider);
                if (provider.equals(PRIMARY)) {
                    throw ProviderException.overloaded(provider, "503");
                }
                return "ok";
            }, 2, BACKOFF);

            assertThat(calls).containsExactly(PRIMARY, PRIMARY, SECONDARY);
            assertThat(sleeps).containsExactly(Duration.ofMillis(100));
            assertThat(result.provider()).isEqualTo(SECONDARY);
        }

        @Test
        void interrupt_while_backing_off_surfaces_as_cancellation() {
            ResilientProviderCaller interrupting = new ResilientProviderCaller(d -> {
                throw new InterruptedException("stop");
            }, Clock.systemUTC());

            assertThatThrownBy(() -> interrupting.call(List.of(PRIMARY), provider -> {
                throw ProviderException.overloaded(provider, "503");
            }, 3, BACKOFF))
                    .isInstanceOf(GenerationException.class)
                    .extracting(e -> ((GenerationException) e).getKind())
                    .isEqualTo(ErrorKind.CANCELLATION_REQUESTED);
            assertThat(Thread.interrupted()).isTrue();
        }
    }

    @Nested
    @DisplayName("Fatal errors and exhaustion")
    class ExhaustionTests {
        @Test
        void fatal_error_fails_over_immediately() {
            ProviderCallResult<String> result = caller.call(List.of(PRIMARY, SECONDARY), provider -> {
                calls.add(provider);
                if (provider.equals(PRIMARY)) {
                    throw ProviderException.fatal(provider, "bad request");
                }
                return "ok";
            }, 3, BACKOFF);

            assertThat(calls).containsExactly(PRIMARY, SECONDARY);
            assertThat(result.attempts().get(0).outcome()).isEqualTo(AttemptOutcome.FATAL_ERROR);
        }

        @Test
        void unclassified_exception_is_treated_as_fatal() {
            ProviderCallResult<String> result = caller.call(List.of(PRIMARY, SECONDARY), provider -> {
                calls.add(provider);
                if (provider.equals(PRIMARY)) {
                    throw new IllegalStateException("boom");
                }
                return "ok";
            }, 3, BACKOFF);

            assertThat(result.provider()).isEqualTo(SECONDARY);
        }

        @Test
        void all_providers_failing_raises_exhausted_with_attempts() {
            assertThatThrownBy(() -> caller.call(List.of(PRIMARY, SECONDARY), provider -> {
                calls.add(provider);
                throw ProviderException.overloaded(provider, "503");
            }, 2, BACKOFF))
                    .isInstanceOfSatisfying(GenerationException.class, e -> {
                        assertThat(e.getKind()).isEqualTo(ErrorKind.ALL_PROVIDERS_EXHAUSTED);
                        assertThat(e.getAttempts()).hasSize(4);
                    });
            assertThat(calls).containsExactly(PRIMARY, PRIMARY, SECONDARY, SECONDARY);
        }

        @Test
        void attempts_never_exceed_max_per_provider() {
            assertThatThrownBy(() -> caller.call(List.of(PRIMARY), provider -> {
                calls.add(provider);
                throw ProviderException.overloaded(provider, "503");
            }, 3, BACKOFF)).isInstanceOf(GenerationException.class);
            assertThat(calls).hasSize(3);
        }
    }

    @Test
    @DisplayName("Cancelled signal stops before the first attempt")
    void cancelled_signal_prevents_attempts() {
        CancellationSignal signal = CancellationSignal.none();
        signal.cancel();

        assertThatThrownBy(() -> caller.call(List.of(PRIMARY), provider -> {
            calls.add(provider);
            return "ok";
        }, 3, BACKOFF, signal))
                .isInstanceOfSatisfying(GenerationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.CANCELLATION_REQUESTED));
        assertThat(calls).isEmpty();
    }

    @Test
    void rejects_invalid_arguments() {
        assertThatThrownBy(() -> caller.call(List.of(), provider -> "ok", 3, BACKOFF))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> caller.call(List.of(PRIMARY), provider -> "ok", 0, BACKOFF))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
