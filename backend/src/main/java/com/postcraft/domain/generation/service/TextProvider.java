package com.postcraft.domain.generation.service;

import com.postcraft.domain.generation.model.ProviderRef;

/**
 * Text-generation backend bound to one {@link ProviderRef}.
 */
public interface TextProvider {

    ProviderRef ref();

    /**
     * Generate text for the prompt.
     *
     * @param prompt fully composed prompt
     * @return raw provider output, trimmed
     * @throws ProviderException classified provider failure
     */
    String generate(String prompt);
}
