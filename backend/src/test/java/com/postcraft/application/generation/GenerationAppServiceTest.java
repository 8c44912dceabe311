package com.postcraft.application.generation;

import com.postcraft.domain.generation.model.BrandContext;
import com.postcraft.domain.generation.model.ErrorKind;
import com.postcraft.domain.generation.model.GenerationRequest;
import com.postcraft.domain.generation.model.GenerationResult;
import com.postcraft.domain.generation.model.GenerationStatus;
import com.postcraft.domain.generation.model.Platform;
import com.postcraft.domain.generation.model.PlatformVariant;
import com.postcraft.domain.generation.service.BrandContextSource;
import com.postcraft.infrastructure.ai.pipeline.GenerationOrchestrator;
import com.postcraft.infrastructure.ai.registry.ModelRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GenerationAppServiceTest {

    @Mock
    private GenerationOrchestrator generationOrchestrator;

    @Mock
    private BrandContextSource brandContextSource;

    @Mock
    private ModelRegistry modelRegistry;

    @InjectMocks
    private GenerationAppService generationAppService;

    private static final BrandContext BRAND = BrandContext.builder().businessName("Corner Bakery").build();
    private static final List<PlatformVariant> VARIANTS = List.of(PlatformVariant.of(Platform.INSTAGRAM));

    private static GenerationResult completed(String requestId) {
        return new GenerationResult(requestId, GenerationStatus.COMPLETED, null, List.of(),
                BigDecimal.ONE, false, null, null, List.of(), false);
    }

    @Test
    @DisplayName("Inline brand is remembered and used")
    void inline_brand_is_remembered() {
        when(generationOrchestrator.generate(any(GenerationRequest.class))).thenReturn(completed("req-1"));

        GenerationResult result = generationAppService.generate("req-1", "acct-1", "tier-1", BRAND, VARIANTS);

        assertThat(result.status()).isEqualTo(GenerationStatus.COMPLETED);
        verify(brandContextSource).remember("acct-1", BRAND);
        ArgumentCaptor<GenerationRequest> captor = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(generationOrchestrator).generate(captor.capture());
        assertThat(captor.getValue().brand()).isEqualTo(BRAND);
        assertThat(captor.getValue().tierId()).isEqualTo("tier-1");
        assertThat(captor.getValue().platformVariants()).isEqualTo(VARIANTS);
    }

    @Test
    @DisplayName("Without an inline brand the remembered one is used")
    void falls_back_to_remembered_brand() {
        when(brandContextSource.findByAccountId("acct-1")).thenReturn(Optional.of(BRAND));
        when(generationOrchestrator.generate(any(GenerationRequest.class))).thenReturn(completed("req-2"));

        generationAppService.generate("req-2", "acct-1", "tier-1", null, VARIANTS);

        ArgumentCaptor<GenerationRequest> captor = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(generationOrchestrator).generate(captor.capture());
        assertThat(captor.getValue().brand().businessName()).isEqualTo("Corner Bakery");
        verify(brandContextSource, never()).remember(any(), any());
    }

    @Test
    void missing_brand_is_invalid_request() {
        when(brandContextSource.findByAccountId("acct-2")).thenReturn(Optional.empty());

        GenerationResult result = generationAppService.generate("req-3", "acct-2", "tier-1", null, VARIANTS);

        assertThat(result.status()).isEqualTo(GenerationStatus.FAILED);
        assertThat(result.failureKind()).isEqualTo(ErrorKind.INVALID_REQUEST);
        verify(generationOrchestrator, never()).generate(any(GenerationRequest.class));
    }
}
