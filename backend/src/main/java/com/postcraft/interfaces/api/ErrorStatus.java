package com.postcraft.interfaces.api;

import com.postcraft.domain.generation.model.ErrorKind;
import org.springframework.http.HttpStatus;

/**
 * HTTP status for each generation error kind.
 */
public final class ErrorStatus {

    private ErrorStatus() {
    }

    public static HttpStatus of(ErrorKind kind) {
        return switch (kind) {
            case UNKNOWN_TIER, INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
            case INSUFFICIENT_CREDITS -> HttpStatus.PAYMENT_REQUIRED;
            case DUPLICATE_REQUEST -> HttpStatus.CONFLICT;
            case PROVIDER_RATE_LIMITED, PROVIDER_OVERLOADED, ALL_PROVIDERS_EXHAUSTED,
                    CORRUPTED_OUTPUT, VARIANT_DEADLINE_EXCEEDED, CANCELLATION_REQUESTED -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }
}
