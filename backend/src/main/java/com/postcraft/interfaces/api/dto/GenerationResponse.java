package com.postcraft.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.postcraft.domain.generation.model.GenerationResult;
import com.postcraft.domain.generation.model.PostCopy;
import com.postcraft.domain.generation.model.QualityWarning;
import com.postcraft.domain.generation.model.VariantResult;

import java.math.BigDecimal;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record GenerationResponse(
        String requestId,
        String status,
        CopyEntry copy,
        List<VariantEntry> variants,
        BigDecimal creditsCharged,
        boolean partial,
        boolean regenerated,
        List<WarningEntry> qualityWarnings,
        String errorCode,
        String errorMessage
) {
    public record CopyEntry(String headline, String subheadline, String caption, String callToAction,
                            List<String> hashtags) {}

    public record VariantEntry(String platform, String aspectRatio, String imageUrl, String provider,
                               List<String> hashtags, String errorCode, String errorMessage) {}

    public record WarningEntry(String field, List<String> issues) {}

    public static GenerationResponse from(GenerationResult result) {
        return new GenerationResponse(
                result.requestId(),
                result.status().name(),
                toCopy(result.copy()),
                result.variants().stream().map(GenerationResponse::toVariant).toList(),
                result.creditsCharged(),
                result.partial(),
                result.regenerated(),
                result.qualityWarnings().stream().map(GenerationResponse::toWarning).toList(),
                result.failureKind() == null ? null : result.failureKind().name(),
                result.failureMessage());
    }

    private static CopyEntry toCopy(PostCopy copy) {
        if (copy == null) return null;
        return new CopyEntry(copy.headline(), copy.subheadline(), copy.caption(), copy.callToAction(), copy.hashtags());
    }

    private static VariantEntry toVariant(VariantResult v) {
        return new VariantEntry(
                v.platform().name(),
                v.aspectRatio().label(),
                v.imageUrl(),
                v.provider() == null ? null : v.provider().name(),
                v.hashtags(),
                v.errorKind() == null ? null : v.errorKind().name(),
                v.errorMessage());
    }

    private static WarningEntry toWarning(QualityWarning w) {
        return new WarningEntry(w.field().jsonKey(), w.issues().stream().map(Enum::name).toList());
    }
}
