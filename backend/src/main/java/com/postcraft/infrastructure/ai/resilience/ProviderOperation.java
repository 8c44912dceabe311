package com.postcraft.infrastructure.ai.resilience;

import com.postcraft.domain.generation.model.ProviderRef;

/**
 * One provider call. Throws {@link com.postcraft.domain.generation.service.ProviderException}
 * to signal a classified failure; any other exception is treated as fatal for that provider.
 */
@FunctionalInterface
public interface ProviderOperation<T> {

    T execute(ProviderRef provider);
}
