package com.postcraft.domain.generation.model;

/**
 * Text fields of a generated post and their word limits.
 */
public enum CopyField {
    HEADLINE("headline", 6, true),
    SUBHEADLINE("subheadline", 25, false),
    CAPTION("caption", 100, true),
    CALL_TO_ACTION("callToAction", 5, false);

    private final String jsonKey;
    private final int maxWords;
    private final boolean required;

    CopyField(String jsonKey, int maxWords, boolean required) {
        this.jsonKey = jsonKey;
        this.maxWords = maxWords;
        this.required = required;
    }

    public String jsonKey() {
        return jsonKey;
    }

    public int maxWords() {
        return maxWords;
    }

    public boolean required() {
        return required;
    }
}
