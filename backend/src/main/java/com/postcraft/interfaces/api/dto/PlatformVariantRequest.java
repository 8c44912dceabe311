package com.postcraft.interfaces.api.dto;

import com.postcraft.domain.generation.model.AspectRatio;
import com.postcraft.domain.generation.model.Platform;
import com.postcraft.domain.generation.model.PlatformVariant;
import jakarta.validation.constraints.NotNull;

/**
 * Aspect ratio is optional and defaults to the platform's own.
 */
public record PlatformVariantRequest(
        @NotNull(message = "Platform is required")
        Platform platform,

        AspectRatio aspectRatio
) {
    public PlatformVariant toVariant() {
        return new PlatformVariant(platform, aspectRatio);
    }
}
