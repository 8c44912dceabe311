package com.postcraft.domain.generation.model;

public record GeneratedImage(String imageUrl, String model) {
}
