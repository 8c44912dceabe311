package com.postcraft.domain.generation.model;

import java.util.List;

/**
 * One invocation of the generation pipeline.
 *
 * @param requestId        caller-supplied idempotency key
 * @param tierId           identifier resolved through the model registry
 * @param brand            brand context to render
 * @param platformVariants requested outputs; may be empty for a copy-only request
 * @param accountId        account whose credits are metered
 */
public record GenerationRequest(
        String requestId,
        String tierId,
        BrandContext brand,
        List<PlatformVariant> platformVariants,
        String accountId
) {
    public GenerationRequest {
        platformVariants = platformVariants == null ? List.of() : List.copyOf(platformVariants);
    }
}
