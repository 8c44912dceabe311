package com.postcraft.domain.generation.model;

/**
 * Lifecycle of a single generation request.
 */
public enum GenerationState {
    PENDING,
    RESERVED,
    TEXT_GENERATING,
    TEXT_VALIDATING,
    IMAGES_GENERATING,
    FINALIZING,
    COMPLETED,
    PARTIALLY_COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == PARTIALLY_COMPLETED || this == FAILED;
    }
}
