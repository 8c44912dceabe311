package com.postcraft.infrastructure.ai.resilience;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Delays between retries on the same provider. Index 0 is the wait after the first failed attempt;
 * indexes past the end reuse the last delay.
 */
public record BackoffSchedule(List<Duration> delays) {

    public BackoffSchedule {
        if (delays == null || delays.isEmpty()) {
            throw new IllegalArgumentException("Backoff schedule needs at least one delay");
        }
        Duration previous = Duration.ZERO;
        for (Duration delay : delays) {
            if (delay == null || delay.isNegative()) {
                throw new IllegalArgumentException("Backoff delays must be non-negative: " + delays);
            }
            if (delay.compareTo(previous) < 0) {
                throw new IllegalArgumentException("Backoff delays must be non-decreasing: " + delays);
            }
            previous = delay;
        }
        delays = List.copyOf(delays);
    }

    /**
     * Exponential schedule {@code base, base*multiplier, ...} capped at {@code max}.
     */
    public static BackoffSchedule exponential(Duration base, double multiplier, Duration max, int steps) {
        if (steps < 1 || multiplier < 1.0) {
            throw new IllegalArgumentException("steps must be >= 1 and multiplier >= 1.0");
        }
        List<Duration> delays = new ArrayList<>(steps);
        double millis = base.toMillis();
        for (int i = 0; i < steps; i++) {
            delays.add(Duration.ofMillis((long) Math.min(millis, max.toMillis())));
            millis *= multiplier;
        }
        return new BackoffSchedule(delays);
    }

    public static BackoffSchedule none() {
        return new BackoffSchedule(List.of(Duration.ZERO));
    }

    public Duration delayFor(int retryIndex) {
        return delays.get(Math.min(retryIndex, delays.size() - 1));
    }
}
