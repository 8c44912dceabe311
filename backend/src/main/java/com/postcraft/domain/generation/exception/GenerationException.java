package com.postcraft.domain.generation.exception;

import com.postcraft.domain.generation.model.ErrorKind;
import com.postcraft.domain.generation.model.GenerationAttempt;

import java.util.List;

/**
 * Orchestration-level failure classified by {@link ErrorKind}.
 */
public class GenerationException extends RuntimeException {

    private final ErrorKind kind;
    private final List<GenerationAttempt> attempts;

    public GenerationException(ErrorKind kind, String message) {
        this(kind, message, List.of());
    }

    public GenerationException(ErrorKind kind, String message, List<GenerationAttempt> attempts) {
        super(message);
        this.kind = kind;
        this.attempts = List.copyOf(attempts);
    }

    public GenerationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.attempts = List.of();
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Provider attempts made before the failure, empty when none were made.
     */
    public List<GenerationAttempt> getAttempts() {
        return attempts;
    }
}
