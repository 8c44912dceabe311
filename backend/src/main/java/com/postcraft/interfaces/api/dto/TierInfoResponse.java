package com.postcraft.interfaces.api.dto;

import com.postcraft.domain.generation.model.ModelTier;

import java.math.BigDecimal;
import java.util.List;

public record TierInfoResponse(
        String id,
        String displayName,
        BigDecimal creditCost,
        int maxImageVariants,
        List<String> capabilities
) {
    public static TierInfoResponse from(ModelTier tier) {
        return new TierInfoResponse(
                tier.id(),
                tier.displayName(),
                tier.creditCost(),
                tier.maxImageVariants(),
                tier.capabilities().stream().map(Enum::name).sorted().toList());
    }
}
