package com.postcraft.infrastructure.ai.provider;

import com.postcraft.domain.generation.model.ProviderRef;
import com.postcraft.domain.generation.service.ImageProvider;
import com.postcraft.domain.generation.service.TextProvider;

import java.util.Collection;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Text and image clients by provider ref.
 */
public class ProviderDirectory {

    private final Map<ProviderRef, TextProvider> textProviders;
    private final Map<ProviderRef, ImageProvider> imageProviders;

    public ProviderDirectory(Collection<TextProvider> textProviders, Collection<ImageProvider> imageProviders) {
        this.textProviders = textProviders.stream()
                .collect(Collectors.toUnmodifiableMap(TextProvider::ref, Function.identity()));
        this.imageProviders = imageProviders.stream()
                .collect(Collectors.toUnmodifiableMap(ImageProvider::ref, Function.identity()));
    }

    public TextProvider text(ProviderRef ref) {
        TextProvider provider = textProviders.get(ref);
        if (provider == null) {
            throw new IllegalStateException("No text provider configured for " + ref);
        }
        return provider;
    }

    public ImageProvider image(ProviderRef ref) {
        ImageProvider provider = imageProviders.get(ref);
        if (provider == null) {
            throw new IllegalStateException("No image provider configured for " + ref);
        }
        return provider;
    }
}
