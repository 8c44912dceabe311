package com.postcraft.domain.generation.model;

/**
 * Opaque handle for one credentialed provider backend with its own rate-limit domain.
 *
 * @param name configuration key of the provider (e.g. "primary", "secondary")
 */
public record ProviderRef(String name) {

    public ProviderRef {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Provider name must not be blank");
        }
    }

    public static ProviderRef of(String name) {
        return new ProviderRef(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
