package com.postcraft.infrastructure.ai.registry;

import com.postcraft.domain.generation.exception.GenerationException;
import com.postcraft.domain.generation.model.ErrorKind;
import com.postcraft.domain.generation.model.ModelTier;
import com.postcraft.domain.generation.model.ProviderRef;
import com.postcraft.infrastructure.config.GenerationProperties;
import com.postcraft.infrastructure.config.ProviderProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable tier table built once from configuration.
 */
@Slf4j
@Component
public class ModelRegistry {

    private final Map<String, ModelTier> tiers;
    private final List<ModelTier> ordered;

    public ModelRegistry(GenerationProperties generationProperties, ProviderProperties providerProperties) {
        Map<String, ModelTier> loaded = new LinkedHashMap<>();
        for (GenerationProperties.Tier tier : generationProperties.tiers()) {
            ModelTier modelTier = toModelTier(tier, providerProperties);
            if (loaded.putIfAbsent(modelTier.id(), modelTier) != null) {
                throw new IllegalStateException("Duplicate tier id: " + modelTier.id());
            }
        }
        if (loaded.isEmpty()) {
            throw new IllegalStateException("No generation tiers configured (generation.tiers)");
        }
        this.tiers = Map.copyOf(loaded);
        this.ordered = List.copyOf(loaded.values());
        log.info("[Registry] Loaded {} tiers: {}", ordered.size(), loaded.keySet());
    }

    /**
     * @throws GenerationException {@link ErrorKind#UNKNOWN_TIER} if no tier has this id
     */
    public ModelTier lookup(String tierId) {
        ModelTier tier = tierId == null ? null : tiers.get(tierId);
        if (tier == null) {
            throw new GenerationException(ErrorKind.UNKNOWN_TIER, "Unknown tier: " + tierId);
        }
        return tier;
    }

    /**
     * All tiers in configuration order.
     */
    public Collection<ModelTier> all() {
        return ordered;
    }

    private static ModelTier toModelTier(GenerationProperties.Tier tier, ProviderProperties providerProperties) {
        if (tier.id() == null || tier.id().isBlank()) {
            throw new IllegalStateException("Tier id is required");
        }
        if (tier.creditCost() == null || tier.creditCost().compareTo(BigDecimal.ZERO) <= 0) {
            throw new IllegalStateException("Tier " + tier.id() + " needs a positive credit cost");
        }
        if (tier.maxImageVariants() < 1) {
            throw new IllegalStateException("Tier " + tier.id() + " needs maxImageVariants >= 1");
        }
        if (tier.providers().isEmpty()) {
            throw new IllegalStateException("Tier " + tier.id() + " names no providers");
        }
        for (String provider : tier.providers()) {
            if (!providerProperties.definitions().containsKey(provider)) {
                throw new IllegalStateException("Tier " + tier.id() + " names unknown provider: " + provider);
            }
        }
        return new ModelTier(
                tier.id(),
                tier.displayName() == null ? tier.id() : tier.displayName(),
                tier.creditCost(),
                tier.promptDirectives(),
                tier.providers().stream().map(ProviderRef::of).toList(),
                tier.maxImageVariants(),
                tier.capabilities());
    }
}
