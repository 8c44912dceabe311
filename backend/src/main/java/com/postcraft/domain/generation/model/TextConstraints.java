package com.postcraft.domain.generation.model;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Constraints applied to one generated text field.
 *
 * @param maxWords            inclusive word limit
 * @param requireEnglishWords reject non-Latin scripts and gibberish tokens
 * @param forbidPatterns      extra disallowed substrings or character runs
 */
public record TextConstraints(
        int maxWords,
        boolean requireEnglishWords,
        List<Pattern> forbidPatterns
) {
    public TextConstraints {
        if (maxWords <= 0) {
            throw new IllegalArgumentException("maxWords must be positive: " + maxWords);
        }
        forbidPatterns = forbidPatterns == null ? List.of() : List.copyOf(forbidPatterns);
    }

    public static TextConstraints maxWords(int maxWords) {
        return new TextConstraints(maxWords, false, List.of());
    }

    public static TextConstraints forField(CopyField field) {
        return new TextConstraints(field.maxWords(), true, List.of());
    }
}
