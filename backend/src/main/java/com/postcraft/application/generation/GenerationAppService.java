package com.postcraft.application.generation;

import com.postcraft.domain.generation.model.BrandContext;
import com.postcraft.domain.generation.model.ErrorKind;
import com.postcraft.domain.generation.model.GenerationRequest;
import com.postcraft.domain.generation.model.GenerationResult;
import com.postcraft.domain.generation.model.ModelTier;
import com.postcraft.domain.generation.model.PlatformVariant;
import com.postcraft.domain.generation.service.BrandContextSource;
import com.postcraft.infrastructure.ai.pipeline.GenerationOrchestrator;
import com.postcraft.infrastructure.ai.registry.ModelRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class GenerationAppService {

    private final GenerationOrchestrator generationOrchestrator;
    private final BrandContextSource brandContextSource;
    private final ModelRegistry modelRegistry;

    /**
     * Run one generation. An inline brand is remembered for the account; without one, the last
     * remembered brand is used.
     */
    public GenerationResult generate(String requestId,
                                     String accountId,
                                     String tierId,
                                     BrandContext inlineBrand,
                                     List<PlatformVariant> variants) {
        BrandContext brand = inlineBrand;
        if (brand != null) {
            brandContextSource.remember(accountId, brand);
        } else {
            brand = brandContextSource.findByAccountId(accountId).orElse(null);
            if (brand == null) {
                log.info("No brand context for account {} (request {})", accountId, requestId);
                return GenerationResult.failed(requestId, ErrorKind.INVALID_REQUEST);
            }
        }

        return generationOrchestrator.generate(new GenerationRequest(requestId, tierId, brand, variants, accountId));
    }

    public Collection<ModelTier> getTiers() {
        return modelRegistry.all();
    }
}
