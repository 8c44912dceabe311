package com.postcraft.domain.generation.model;

public enum TierCapability {
    LOGO_REFERENCE,
    MULTIPLE_ASPECT_RATIOS,
    HD_RENDERING
}
