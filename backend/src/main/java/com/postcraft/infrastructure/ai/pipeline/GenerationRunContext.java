package com.postcraft.infrastructure.ai.pipeline;

import com.postcraft.domain.generation.model.CancellationSignal;
import com.postcraft.domain.generation.model.GenerationRequest;
import com.postcraft.domain.generation.model.GenerationState;
import com.postcraft.domain.generation.model.ModelTier;
import com.postcraft.domain.generation.model.PostCopy;
import com.postcraft.domain.generation.model.QualityWarning;
import com.postcraft.domain.generation.model.VariantResult;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one generation request, owned by the orchestrating thread.
 */
@Slf4j
@Getter
@Setter
public class GenerationRunContext {

    // --- Input ---
    private final GenerationRequest request;
    private final CancellationSignal cancellation;

    // --- Pre-flight ---
    private ModelTier tier;
    private BigDecimal amount = BigDecimal.ZERO;

    // --- Text ---
    private PostCopy copy;
    private List<QualityWarning> qualityWarnings = new ArrayList<>();
    private boolean regenerated;

    // --- Images ---
    private List<VariantResult> variants = new ArrayList<>();

    private GenerationState state = GenerationState.PENDING;

    public GenerationRunContext(GenerationRequest request, CancellationSignal cancellation) {
        this.request = request;
        this.cancellation = cancellation;
    }

    public void transition(GenerationState next) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Request " + request.requestId() + " already finished in " + state);
        }
        log.debug("[Orchestrator] {} {} -> {}", request.requestId(), state, next);
        state = next;
    }

    public String requestId() {
        return request.requestId();
    }
}
