package com.postcraft.domain.generation.model;

/**
 * One requested output artifact: a platform plus the aspect ratio to render for it.
 */
public record PlatformVariant(Platform platform, AspectRatio aspectRatio) {

    public PlatformVariant {
        if (platform == null) {
            throw new IllegalArgumentException("Platform is required");
        }
        if (aspectRatio == null) {
            aspectRatio = platform.defaultAspectRatio();
        }
    }

    public static PlatformVariant of(Platform platform) {
        return new PlatformVariant(platform, platform.defaultAspectRatio());
    }
}
