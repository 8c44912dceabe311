package com.postcraft.domain.generation.model;

public enum GenerationStatus {
    COMPLETED,
    PARTIALLY_COMPLETED,
    FAILED
}
