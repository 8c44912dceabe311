package com.postcraft.interfaces.api.generation;

import com.postcraft.application.generation.GenerationAppService;
import com.postcraft.domain.generation.model.GenerationResult;
import com.postcraft.domain.generation.model.GenerationStatus;
import com.postcraft.domain.generation.model.PlatformVariant;
import com.postcraft.interfaces.api.ErrorStatus;
import com.postcraft.interfaces.api.dto.GenerateRequest;
import com.postcraft.interfaces.api.dto.GenerationResponse;
import com.postcraft.interfaces.api.dto.PlatformVariantRequest;
import com.postcraft.interfaces.api.dto.TierInfoResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class GenerationController {

    private final GenerationAppService generationAppService;

    @PostMapping("/generations")
    public ResponseEntity<GenerationResponse> generate(@Valid @RequestBody GenerateRequest request) {
        List<PlatformVariant> variants = request.variants() == null
                ? List.of()
                : request.variants().stream().map(PlatformVariantRequest::toVariant).toList();

        GenerationResult result = generationAppService.generate(
                request.requestId(),
                request.accountId(),
                request.tierId(),
                request.brand() == null ? null : request.brand().toBrandContext(),
                variants);

        if (result.status() == GenerationStatus.FAILED) {
            return ResponseEntity.status(ErrorStatus.of(result.failureKind()))
                    .body(GenerationResponse.from(result));
        }
        return ResponseEntity.ok(GenerationResponse.from(result));
    }

    @GetMapping("/tiers")
    public ResponseEntity<List<TierInfoResponse>> getTiers() {
        return ResponseEntity.ok(generationAppService.getTiers().stream()
                .map(TierInfoResponse::from)
                .toList());
    }
}
