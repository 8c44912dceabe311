package com.postcraft.domain.generation.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Final outcome of a request. Returned to the caller and not retained.
 */
public record GenerationResult(
        String requestId,
        GenerationStatus status,
        PostCopy copy,
        List<VariantResult> variants,
        BigDecimal creditsCharged,
        boolean partial,
        ErrorKind failureKind,
        String failureMessage,
        List<QualityWarning> qualityWarnings,
        boolean regenerated
) {
    public GenerationResult {
        variants = variants == null ? List.of() : List.copyOf(variants);
        qualityWarnings = qualityWarnings == null ? List.of() : List.copyOf(qualityWarnings);
    }

    public static GenerationResult failed(String requestId, ErrorKind kind) {
        return new GenerationResult(requestId, GenerationStatus.FAILED, null, List.of(),
                BigDecimal.ZERO, false, kind, kind.userMessage(), List.of(), false);
    }

    public List<VariantResult> failedVariants() {
        return variants.stream().filter(v -> !v.succeeded()).toList();
    }

    public List<VariantResult> succeededVariants() {
        return variants.stream().filter(VariantResult::succeeded).toList();
    }
}
