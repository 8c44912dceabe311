package com.postcraft.interfaces.api.dto;

import com.postcraft.domain.generation.model.BrandConsistency;
import com.postcraft.domain.generation.model.BrandContext;
import com.postcraft.domain.generation.model.BusinessType;
import com.postcraft.domain.generation.model.ContactInfo;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record BrandContextRequest(
        @NotBlank(message = "Business name is required")
        @Size(max = 120, message = "Business name must not exceed 120 characters")
        String businessName,

        BusinessType businessType,

        @Size(max = 200, message = "Location must not exceed 200 characters")
        String location,

        @Size(max = 300, message = "Target audience must not exceed 300 characters")
        String targetAudience,

        @Size(max = 500, message = "Brand voice must not exceed 500 characters")
        String brandVoice,

        String primaryColor,
        String accentColor,
        String phone,
        String email,
        String website,
        String address,
        String logoUrl,

        Boolean useBrandVoice,
        Boolean followBrandColors,
        Boolean includeContacts,
        Boolean includeLogo
) {
    public BrandContext toBrandContext() {
        return BrandContext.builder()
                .businessName(businessName)
                .businessType(businessType)
                .location(location)
                .targetAudience(targetAudience)
                .brandVoice(brandVoice)
                .primaryColor(primaryColor)
                .accentColor(accentColor)
                .contactInfo(new ContactInfo(phone, email, website, address))
                .logoUrl(logoUrl)
                .consistency(new BrandConsistency(
                        !Boolean.FALSE.equals(useBrandVoice),
                        !Boolean.FALSE.equals(followBrandColors),
                        !Boolean.FALSE.equals(includeContacts),
                        !Boolean.FALSE.equals(includeLogo)))
                .build();
    }
}
