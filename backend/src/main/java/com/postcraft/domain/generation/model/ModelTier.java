package com.postcraft.domain.generation.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

/**
 * A named generation quality/cost level. Immutable once loaded by the registry.
 *
 * @param id                      tier identifier used by callers (e.g. "tier-1")
 * @param displayName             human-readable tier name
 * @param creditCost              credits charged per image variant
 * @param promptDirectives        tier-specific style directives, in prompt order
 * @param providerPreferenceOrder providers tried in order for every call of this tier
 * @param maxImageVariants        upper bound on variants per request
 * @param capabilities            optional features enabled for this tier
 */
public record ModelTier(
        String id,
        String displayName,
        BigDecimal creditCost,
        List<String> promptDirectives,
        List<ProviderRef> providerPreferenceOrder,
        int maxImageVariants,
        Set<TierCapability> capabilities
) {
    public ModelTier {
        promptDirectives = List.copyOf(promptDirectives);
        providerPreferenceOrder = List.copyOf(providerPreferenceOrder);
        capabilities = capabilities.isEmpty() ? Set.of() : Set.copyOf(capabilities);
    }

    public boolean supports(TierCapability capability) {
        return capabilities.contains(capability);
    }
}
