package com.postcraft.domain.generation.service;

/**
 * The only provider error classes the retry policy distinguishes.
 */
public enum ProviderFailure {
    /** Quota or too-many-requests; fail over, never wait on the same provider. */
    RATE_LIMITED,
    /** Temporary unavailability; back off and retry the same provider. */
    OVERLOADED,
    /** Anything else; abandon this provider. */
    FATAL
}
