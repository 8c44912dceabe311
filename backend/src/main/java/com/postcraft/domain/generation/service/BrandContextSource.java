package com.postcraft.domain.generation.service;

import com.postcraft.domain.generation.model.BrandContext;

import java.util.Optional;

/**
 * Supplies the brand context for accounts whose requests do not carry one inline.
 */
public interface BrandContextSource {

    Optional<BrandContext> findByAccountId(String accountId);

    /**
     * Keep the latest brand context an account sent, for later requests that omit it.
     */
    void remember(String accountId, BrandContext brand);
}
