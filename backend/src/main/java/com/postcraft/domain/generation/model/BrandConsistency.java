package com.postcraft.domain.generation.model;

/**
 * Brand-consistency toggles. A toggle that is off removes the matching prompt instruction entirely.
 */
public record BrandConsistency(
        boolean useBrandVoice,
        boolean followBrandColors,
        boolean includeContacts,
        boolean includeLogo
) {
    public static BrandConsistency allEnabled() {
        return new BrandConsistency(true, true, true, true);
    }
}
