package com.postcraft.domain.generation.model;

import java.util.List;

/**
 * Outcome of one platform variant. Exactly one of {@code imageUrl} and {@code errorKind} is set.
 */
public record VariantResult(
        Platform platform,
        AspectRatio aspectRatio,
        String imageUrl,
        ErrorKind errorKind,
        String errorMessage,
        ProviderRef provider,
        int attempts,
        List<String> hashtags
) {
    public VariantResult {
        hashtags = hashtags == null ? List.of() : List.copyOf(hashtags);
    }

    public static VariantResult success(PlatformVariant variant, String imageUrl, ProviderRef provider,
                                        int attempts, List<String> hashtags) {
        return new VariantResult(variant.platform(), variant.aspectRatio(), imageUrl,
                null, null, provider, attempts, hashtags);
    }

    public static VariantResult failure(PlatformVariant variant, ErrorKind errorKind, int attempts) {
        return new VariantResult(variant.platform(), variant.aspectRatio(), null,
                errorKind, errorKind.userMessage(), null, attempts, List.of());
    }

    public boolean succeeded() {
        return errorKind == null;
    }
}
