package com.postcraft.domain.generation.model;

/**
 * Optional reference image (typically the brand logo) handed to an image provider.
 */
public record ReferenceAsset(String url) {
}
