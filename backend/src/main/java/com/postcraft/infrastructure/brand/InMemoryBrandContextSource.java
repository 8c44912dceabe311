package com.postcraft.infrastructure.brand;

import com.postcraft.domain.generation.model.BrandContext;
import com.postcraft.domain.generation.service.BrandContextSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Process-local brand lookup. Contents are lost on restart, and only the most recently used
 * {@code generation.brand-cache.max-entries} accounts are kept.
 */
@Slf4j
@Component
public class InMemoryBrandContextSource implements BrandContextSource {

    private final Map<String, BrandContext> brands;

    public InMemoryBrandContextSource(@Value("${generation.brand-cache.max-entries:10000}") int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("generation.brand-cache.max-entries must be >= 1: " + maxEntries);
        }
        // Access-ordered so the least recently used account is evicted first
        this.brands = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, BrandContext> eldest) {
                boolean evict = size() > maxEntries;
                if (evict) {
                    log.debug("Evicting remembered brand for account {}", eldest.getKey());
                }
                return evict;
            }
        };
    }

    @Override
    public synchronized Optional<BrandContext> findByAccountId(String accountId) {
        return accountId == null ? Optional.empty() : Optional.ofNullable(brands.get(accountId));
    }

    @Override
    public synchronized void remember(String accountId, BrandContext brand) {
        brands.put(accountId, brand);
    }
}
