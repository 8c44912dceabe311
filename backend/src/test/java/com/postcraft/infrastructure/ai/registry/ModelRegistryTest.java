package com.postcraft.infrastructure.ai.registry;

import com.postcraft.domain.generation.exception.GenerationException;
import com.postcraft.domain.generation.model.ErrorKind;
import com.postcraft.domain.generation.model.ModelTier;
import com.postcraft.domain.generation.model.ProviderRef;
import com.postcraft.domain.generation.model.TierCapability;
import com.postcraft.infrastructure.config.GenerationProperties;
import com.postcraft.infrastructure.config.ProviderProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelRegistryTest {

    private static final ProviderProperties PROVIDERS = new ProviderProperties(Map.of(
            "primary", new ProviderProperties.Provider(null, "k1", null, null, null, null, null),
            "secondary", new ProviderProperties.Provider(null, "k2", null, null, null, null, null)), 0, 0);

    private static GenerationProperties.Tier tier(String id, String cost, List<String> providers) {
        return new GenerationProperties.Tier(id, id.toUpperCase(), new BigDecimal(cost),
                List.of("Keep it simple."), providers, 2, Set.of(TierCapability.HD_RENDERING));
    }

    private static ModelRegistry registry(GenerationProperties.Tier... tiers) {
        return new ModelRegistry(new GenerationProperties(List.of(tiers), null, null, null, null), PROVIDERS);
    }

    @Test
    @DisplayName("Lookup returns the configured tier")
    void lookup_returns_tier() {
        ModelRegistry registry = registry(
                tier("tier-1", "1", List.of("primary", "secondary")),
                tier("tier-3", "5", List.of("secondary")));

        ModelTier tier = registry.lookup("tier-1");

        assertThat(tier.creditCost()).isEqualByComparingTo("1");
        assertThat(tier.providerPreferenceOrder()).containsExactly(ProviderRef.of("primary"), ProviderRef.of("secondary"));
        assertThat(tier.supports(TierCapability.HD_RENDERING)).isTrue();
        assertThat(registry.all()).extracting(ModelTier::id).containsExactly("tier-1", "tier-3");
    }

    @Test
    @DisplayName("Unknown tier id fails with UNKNOWN_TIER")
    void unknown_tier_fails() {
        ModelRegistry registry = registry(tier("tier-1", "1", List.of("primary")));

        assertThatThrownBy(() -> registry.lookup("tier-9"))
                .isInstanceOfSatisfying(GenerationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.UNKNOWN_TIER));
        assertThatThrownBy(() -> registry.lookup(null)).isInstanceOf(GenerationException.class);
    }

    @Test
    @DisplayName("Invalid tables fail at start-up")
    void invalid_configuration_is_rejected() {
        assertThatThrownBy(() -> registry(tier("tier-1", "1", List.of("primary")), tier("tier-1", "2", List.of("primary"))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate");
        assertThatThrownBy(() -> registry(tier("tier-1", "1", List.of("tertiary"))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("tertiary");
        assertThatThrownBy(() -> registry(tier("tier-1", "0", List.of("primary"))))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> registry())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Loaded tiers cannot be modified")
    void tiers_are_immutable() {
        ModelTier tier = registry(tier("tier-1", "1", List.of("primary"))).lookup("tier-1");
        assertThatThrownBy(() -> tier.promptDirectives().add("more"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(tier.promptDirectives()).containsExactly("Keep it simple.");
    }
}
