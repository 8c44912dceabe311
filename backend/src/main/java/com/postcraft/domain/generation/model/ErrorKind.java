package com.postcraft.domain.generation.model;

/**
 * Error taxonomy exposed across the generation boundary. Provider-specific codes never leak past it.
 */
public enum ErrorKind {
    UNKNOWN_TIER(false, "The selected model tier is not available."),
    INSUFFICIENT_CREDITS(false, "You do not have enough credits for this generation."),
    INVALID_REQUEST(false, "The generation request is invalid."),
    DUPLICATE_REQUEST(false, "This request has already been processed."),
    PROVIDER_RATE_LIMITED(true, "The generation service is receiving too many requests, please try again shortly."),
    PROVIDER_OVERLOADED(true, "The generation service is currently overloaded, please try again."),
    ALL_PROVIDERS_EXHAUSTED(true, "The generation service is currently unavailable, please try again later."),
    CORRUPTED_OUTPUT(true, "The generated text did not pass quality checks."),
    VARIANT_DEADLINE_EXCEEDED(true, "The image took too long to generate."),
    CANCELLATION_REQUESTED(false, "The generation was cancelled.");

    private final boolean retryable;
    private final String userMessage;

    ErrorKind(boolean retryable, String userMessage) {
        this.retryable = retryable;
        this.userMessage = userMessage;
    }

    public boolean retryable() {
        return retryable;
    }

    public String userMessage() {
        return userMessage;
    }
}
