package com.postcraft.domain.generation.model;

public enum AspectRatio {
    SQUARE("1:1"),
    PORTRAIT("4:5"),
    STORY("9:16"),
    LANDSCAPE("16:9");

    private final String label;

    AspectRatio(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
