package com.postcraft.domain.generation.model;

public enum AttemptOutcome {
    SUCCESS,
    RETRYABLE_ERROR,
    FATAL_ERROR
}
