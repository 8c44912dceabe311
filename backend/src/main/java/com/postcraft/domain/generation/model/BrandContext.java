package com.postcraft.domain.generation.model;

import lombok.Builder;

/**
 * Caller-owned description of the business. Never persisted by the generation layer.
 */
@Builder
public record BrandContext(
        String businessName,
        BusinessType businessType,
        String location,
        String targetAudience,
        String brandVoice,
        String primaryColor,
        String accentColor,
        ContactInfo contactInfo,
        String logoUrl,
        BrandConsistency consistency
) {
    public BrandContext {
        if (businessType == null) {
            businessType = BusinessType.OTHER;
        }
        if (consistency == null) {
            consistency = BrandConsistency.allEnabled();
        }
    }

    public boolean hasLogo() {
        return logoUrl != null && !logoUrl.isBlank();
    }
}
