package com.postcraft.domain.generation.model;

public enum IssueKind {
    EMPTY_TEXT,
    OVER_LENGTH,
    CORRUPTED_PATTERN
}
