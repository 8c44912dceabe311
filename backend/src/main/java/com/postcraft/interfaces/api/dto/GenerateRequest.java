package com.postcraft.interfaces.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

public record GenerateRequest(
        @NotBlank(message = "Request id is required")
        @Size(max = 128, message = "Request id must not exceed 128 characters")
        String requestId,

        @NotBlank(message = "Account id is required")
        @Size(max = 64, message = "Account id must not exceed 64 characters")
        String accountId,

        @NotBlank(message = "Tier is required")
        String tierId,

        @Valid
        BrandContextRequest brand,

        List<@NotNull(message = "Variant entries must not be null") @Valid PlatformVariantRequest> variants
) {}
