package com.postcraft.domain.generation.model;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Structured text content of a generated post.
 */
public record PostCopy(
        String headline,
        String subheadline,
        String caption,
        String callToAction,
        List<String> hashtags
) {
    public PostCopy {
        hashtags = hashtags == null ? List.of() : List.copyOf(hashtags);
    }

    public String get(CopyField field) {
        return switch (field) {
            case HEADLINE -> headline;
            case SUBHEADLINE -> subheadline;
            case CAPTION -> caption;
            case CALL_TO_ACTION -> callToAction;
        };
    }

    public PostCopy with(Map<CopyField, String> replacements) {
        Map<CopyField, String> fields = new EnumMap<>(CopyField.class);
        for (CopyField field : CopyField.values()) {
            fields.put(field, replacements.getOrDefault(field, get(field)));
        }
        return new PostCopy(
                fields.get(CopyField.HEADLINE),
                fields.get(CopyField.SUBHEADLINE),
                fields.get(CopyField.CAPTION),
                fields.get(CopyField.CALL_TO_ACTION),
                hashtags);
    }

    /**
     * Hashtags capped to what the given platform tolerates.
     */
    public List<String> hashtagsFor(Platform platform) {
        return hashtags.size() <= platform.maxHashtags()
                ? hashtags
                : hashtags.subList(0, platform.maxHashtags());
    }
}
