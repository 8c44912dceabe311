package com.postcraft.infrastructure.config;

import com.postcraft.domain.generation.model.TierCapability;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Orchestration settings and the tier table. Missing values fall back to the defaults below.
 */
@ConfigurationProperties(prefix = "generation")
public record GenerationProperties(
        List<Tier> tiers,
        Resilience resilience,
        Duration variantDeadline,
        Executor executor,
        Reaper reaper
) {
    public GenerationProperties {
        if (tiers == null) tiers = List.of();
        if (resilience == null) resilience = new Resilience(0, null);
        if (variantDeadline == null) variantDeadline = Duration.ofSeconds(90);
        if (executor == null) executor = new Executor(0, 0, 0);
        if (reaper == null) reaper = new Reaper(null);
    }

    public record Tier(
            String id,
            String displayName,
            BigDecimal creditCost,
            List<String> promptDirectives,
            List<String> providers,
            int maxImageVariants,
            Set<TierCapability> capabilities
    ) {
        public Tier {
            if (promptDirectives == null) promptDirectives = List.of();
            if (providers == null) providers = List.of();
            if (capabilities == null) capabilities = Set.of();
        }
    }

    public record Resilience(int maxAttemptsPerProvider, Backoff backoff) {
        public Resilience {
            if (maxAttemptsPerProvider <= 0) maxAttemptsPerProvider = 3;
            if (backoff == null) backoff = new Backoff(null, 0, null, 0);
        }
    }

    public record Backoff(Duration base, double multiplier, Duration max, int steps) {
        public Backoff {
            if (base == null) base = Duration.ofSeconds(1);
            if (multiplier < 1.0) multiplier = 2.0;
            if (max == null) max = Duration.ofSeconds(30);
            if (steps <= 0) steps = 5;
        }
    }

    public record Executor(int corePoolSize, int maxPoolSize, int queueCapacity) {
        public Executor {
            if (corePoolSize <= 0) corePoolSize = 4;
            if (maxPoolSize < corePoolSize) maxPoolSize = Math.max(8, corePoolSize);
            if (queueCapacity <= 0) queueCapacity = 100;
        }
    }

    public record Reaper(Duration reservationTtl) {
        public Reaper {
            if (reservationTtl == null) reservationTtl = Duration.ofMinutes(15);
        }
    }
}
