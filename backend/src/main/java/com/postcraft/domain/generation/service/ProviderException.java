package com.postcraft.domain.generation.service;

import com.postcraft.domain.generation.model.ProviderRef;
import lombok.Getter;

/**
 * Raised by provider adapters. Carries the failure class instead of a raw status code.
 */
@Getter
public class ProviderException extends RuntimeException {

    private final ProviderRef provider;
    private final ProviderFailure failure;

    public ProviderException(ProviderRef provider, ProviderFailure failure, String message) {
        super(message);
        this.provider = provider;
        this.failure = failure;
    }

    public ProviderException(ProviderRef provider, ProviderFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.failure = failure;
    }

    public static ProviderException rateLimited(ProviderRef provider, String message) {
        return new ProviderException(provider, ProviderFailure.RATE_LIMITED, message);
    }

    public static ProviderException overloaded(ProviderRef provider, String message) {
        return new ProviderException(provider, ProviderFailure.OVERLOADED, message);
    }

    public static ProviderException fatal(ProviderRef provider, String message) {
        return new ProviderException(provider, ProviderFailure.FATAL, message);
    }
}
