package com.postcraft.domain.generation.model;

/**
 * Target social platform. Each platform carries its own hashtag cap and default framing.
 */
public enum Platform {
    INSTAGRAM(15, AspectRatio.SQUARE),
    FACEBOOK(5, AspectRatio.SQUARE),
    LINKEDIN(3, AspectRatio.LANDSCAPE),
    TWITTER(2, AspectRatio.LANDSCAPE),
    TIKTOK(5, AspectRatio.STORY);

    private final int maxHashtags;
    private final AspectRatio defaultAspectRatio;

    Platform(int maxHashtags, AspectRatio defaultAspectRatio) {
        this.maxHashtags = maxHashtags;
        this.defaultAspectRatio = defaultAspectRatio;
    }

    public int maxHashtags() {
        return maxHashtags;
    }

    public AspectRatio defaultAspectRatio() {
        return defaultAspectRatio;
    }
}
