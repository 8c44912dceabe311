package com.postcraft.infrastructure.ai;

import com.postcraft.domain.generation.model.GenerationStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

@Slf4j
@Component
public class GenerationMetricsTracker {

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong completedRequests = new AtomicLong();
    private final AtomicLong partialRequests = new AtomicLong();
    private final AtomicLong failedRequests = new AtomicLong();
    private final AtomicLong failovers = new AtomicLong();
    private final AtomicLong regenerations = new AtomicLong();
    private final AtomicLong totalPromptTokens = new AtomicLong();
    private final AtomicLong totalCompletionTokens = new AtomicLong();
    private final AtomicReference<BigDecimal> creditsCommitted = new AtomicReference<>(BigDecimal.ZERO);

    public void recordOutcome(GenerationStatus status, BigDecimal creditsCharged) {
        long total = totalRequests.incrementAndGet();
        switch (status) {
            case COMPLETED -> completedRequests.incrementAndGet();
            case PARTIALLY_COMPLETED -> partialRequests.incrementAndGet();
            case FAILED -> failedRequests.incrementAndGet();
        }
        if (creditsCharged != null && creditsCharged.signum() > 0) {
            creditsCommitted.accumulateAndGet(creditsCharged, BigDecimal::add);
        }

        log.info("Generation metrics - request #{}: status={}, charged={}, " +
                        "cumulative: completed={}, partial={}, failed={}, successRate={}%, failovers={}, regenerations={}, credits={}",
                total, status, creditsCharged,
                completedRequests.get(), partialRequests.get(), failedRequests.get(),
                String.format("%.1f", getSuccessRate()), failovers.get(), regenerations.get(), creditsCommitted.get());
    }

    public void recordFailover() {
        failovers.incrementAndGet();
    }

    public void recordRegeneration() {
        regenerations.incrementAndGet();
    }

    public void recordTokens(long promptTokens, long completionTokens) {
        totalPromptTokens.addAndGet(promptTokens);
        totalCompletionTokens.addAndGet(completionTokens);
    }

    /**
     * Share of requests that produced at least one deliverable, in percent.
     */
    public double getSuccessRate() {
        long total = totalRequests.get();
        return total > 0 ? (double) (completedRequests.get() + partialRequests.get()) / total * 100 : 0;
    }

    public long getFailovers() {
        return failovers.get();
    }

    public long getRegenerations() {
        return regenerations.get();
    }

    public BigDecimal getCreditsCommitted() {
        return creditsCommitted.get();
    }

    public long getTotalPromptTokens() {
        return totalPromptTokens.get();
    }

    public long getTotalCompletionTokens() {
        return totalCompletionTokens.get();
    }
}
