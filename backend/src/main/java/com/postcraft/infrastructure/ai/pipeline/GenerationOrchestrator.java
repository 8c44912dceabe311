package com.postcraft.infrastructure.ai.pipeline;

import com.postcraft.domain.credit.model.ReservationOutcome;
import com.postcraft.domain.credit.service.CreditMeteringService;
import com.postcraft.domain.generation.exception.GenerationException;
import com.postcraft.domain.generation.model.AspectRatio;
import com.postcraft.domain.generation.model.BrandContext;
import com.postcraft.domain.generation.model.CancellationSignal;
import com.postcraft.domain.generation.model.CopyField;
import com.postcraft.domain.generation.model.ErrorKind;
import com.postcraft.domain.generation.model.GeneratedImage;
import com.postcraft.domain.generation.model.GenerationRequest;
import com.postcraft.domain.generation.model.GenerationResult;
import com.postcraft.domain.generation.model.GenerationState;
import com.postcraft.domain.generation.model.GenerationStatus;
import com.postcraft.domain.generation.model.IssueKind;
import com.postcraft.domain.generation.model.ModelTier;
import com.postcraft.domain.generation.model.Platform;
import com.postcraft.domain.generation.model.PlatformVariant;
import com.postcraft.domain.generation.model.PostCopy;
import com.postcraft.domain.generation.model.QualityWarning;
import com.postcraft.domain.generation.model.ReferenceAsset;
import com.postcraft.domain.generation.model.TextConstraints;
import com.postcraft.domain.generation.model.TierCapability;
import com.postcraft.domain.generation.model.ValidationVerdict;
import com.postcraft.domain.generation.model.VariantResult;
import com.postcraft.domain.generation.service.ProviderException;
import com.postcraft.domain.generation.service.ProviderFailure;
import com.postcraft.infrastructure.ai.CopyResponseParser;
import com.postcraft.infrastructure.ai.GenerationMetricsTracker;
import com.postcraft.infrastructure.ai.prompt.PromptComposer;
import com.postcraft.infrastructure.ai.provider.ProviderDirectory;
import com.postcraft.infrastructure.ai.registry.ModelRegistry;
import com.postcraft.infrastructure.ai.resilience.BackoffSchedule;
import com.postcraft.infrastructure.ai.resilience.ProviderCallResult;
import com.postcraft.infrastructure.ai.resilience.ResilientProviderCaller;
import com.postcraft.infrastructure.ai.validation.OutputValidator;
import com.postcraft.infrastructure.config.GenerationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Drives one generation request end to end:
 * <p>
 * pre-flight → reserve → copy (text + validate, one regeneration) → images per variant → commit/refund
 * </p>
 * Every path that reserved credits ends in exactly one commit or refund.
 */
@Slf4j
@Component
public class GenerationOrchestrator {

    static final String CORRECTIVE_HINT = """
            Your previous answer contained corrupted, misspelled or non-English words.
            Rewrite every field using only real, correctly spelled English words.
            Do not invent words, spellings or brand names that were not given to you.""";

    private final ModelRegistry modelRegistry;
    private final CreditMeteringService creditMeteringService;
    private final PromptComposer promptComposer;
    private final OutputValidator outputValidator;
    private final CopyResponseParser copyResponseParser;
    private final ResilientProviderCaller providerCaller;
    private final ProviderDirectory providers;
    private final GenerationMetricsTracker metrics;
    private final Executor generationExecutor;

    private final int maxAttemptsPerProvider;
    private final BackoffSchedule backoff;
    private final Duration variantDeadline;

    public GenerationOrchestrator(ModelRegistry modelRegistry,
                                  CreditMeteringService creditMeteringService,
                                  PromptComposer promptComposer,
                                  OutputValidator outputValidator,
                                  CopyResponseParser copyResponseParser,
                                  ResilientProviderCaller providerCaller,
                                  ProviderDirectory providers,
                                  GenerationMetricsTracker metrics,
                                  @Qualifier("generationExecutor") Executor generationExecutor,
                                  GenerationProperties properties) {
        this.modelRegistry = modelRegistry;
        this.creditMeteringService = creditMeteringService;
        this.promptComposer = promptComposer;
        this.outputValidator = outputValidator;
        this.copyResponseParser = copyResponseParser;
        this.providerCaller = providerCaller;
        this.providers = providers;
        this.metrics = metrics;
        this.generationExecutor = generationExecutor;

        GenerationProperties.Resilience resilience = properties.resilience();
        GenerationProperties.Backoff schedule = resilience.backoff();
        this.maxAttemptsPerProvider = resilience.maxAttemptsPerProvider();
        this.backoff = BackoffSchedule.exponential(schedule.base(), schedule.multiplier(), schedule.max(), schedule.steps());
        this.variantDeadline = properties.variantDeadline();
    }

    public GenerationResult generate(GenerationRequest request) {
        return generate(request, CancellationSignal.none());
    }

    public GenerationResult generate(GenerationRequest request, CancellationSignal cancellation) {
        GenerationRunContext ctx = new GenerationRunContext(request, cancellation);

        // 1. Pre-flight: nothing below may have side effects until the reservation succeeds
        try {
            preflight(ctx);
        } catch (GenerationException e) {
            log.info("[Orchestrator] Request {} rejected before reservation: {} ({})",
                    request.requestId(), e.getKind(), e.getMessage());
            return finish(ctx, GenerationResult.failed(request.requestId(), e.getKind()));
        }
        if (cancellation.isCancelled()) {
            return finish(ctx, GenerationResult.failed(request.requestId(), ErrorKind.CANCELLATION_REQUESTED));
        }

        // 2. Reserve
        ReservationOutcome reservation = creditMeteringService.reserve(
                request.accountId(), ctx.getAmount(), request.requestId());
        if (!reservation.ok()) {
            return finish(ctx, GenerationResult.failed(request.requestId(), ErrorKind.INSUFFICIENT_CREDITS));
        }
        if (reservation.replayed()) {
            log.warn("[Orchestrator] Request {} already holds a {} reservation, not running again",
                    request.requestId(), reservation.status());
            return finish(ctx, GenerationResult.failed(request.requestId(), ErrorKind.DUPLICATE_REQUEST));
        }
        ctx.transition(GenerationState.RESERVED);

        // 3-5. Text, images, settlement
        GenerationResult result = null;
        try {
            result = executeReserved(ctx);
        } finally {
            settle(ctx, result);
        }
        return finish(ctx, result);
    }

    // ===== Pre-flight =====

    private void preflight(GenerationRunContext ctx) {
        GenerationRequest request = ctx.getRequest();
        requireText(request.requestId(), "requestId");
        requireText(request.accountId(), "accountId");
        if (request.brand() == null) {
            throw new GenerationException(ErrorKind.INVALID_REQUEST, "Brand context is required");
        }
        requireText(request.brand().businessName(), "businessName");

        ModelTier tier = modelRegistry.lookup(request.tierId());
        List<PlatformVariant> variants = request.platformVariants();
        if (variants.size() > tier.maxImageVariants()) {
            throw new GenerationException(ErrorKind.INVALID_REQUEST,
                    "Tier " + tier.id() + " allows at most " + tier.maxImageVariants() + " variants, got " + variants.size());
        }
        boolean nonSquare = variants.stream().anyMatch(v -> v.aspectRatio() != AspectRatio.SQUARE);
        if (nonSquare && !tier.supports(TierCapability.MULTIPLE_ASPECT_RATIOS)) {
            throw new GenerationException(ErrorKind.INVALID_REQUEST,
                    "Tier " + tier.id() + " only renders square images");
        }

        ctx.setTier(tier);
        ctx.setAmount(creditMeteringService.quote(tier, variants.size()));
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new GenerationException(ErrorKind.INVALID_REQUEST, name + " is required");
        }
    }

    // ===== Reserved phase =====

    private GenerationResult executeReserved(GenerationRunContext ctx) {
        ctx.transition(GenerationState.TEXT_GENERATING);
        if (ctx.getCancellation().isCancelled()) {
            return GenerationResult.failed(ctx.requestId(), ErrorKind.CANCELLATION_REQUESTED);
        }

        PostCopy firstCopy;
        try {
            firstCopy = generateCopy(ctx, null);
        } catch (GenerationException e) {
            log.error("[Orchestrator] Copy generation failed for {}: {}", ctx.requestId(), e.getMessage());
            return GenerationResult.failed(ctx.requestId(), e.getKind());
        }

        ctx.transition(GenerationState.TEXT_VALIDATING);
        reviewCopy(ctx, firstCopy);

        ctx.transition(GenerationState.IMAGES_GENERATING);
        ctx.setVariants(generateVariants(ctx));

        ctx.transition(GenerationState.FINALIZING);
        return aggregate(ctx);
    }

    // ===== Text =====

    private PostCopy generateCopy(GenerationRunContext ctx, String correctiveHint) {
        GenerationRequest request = ctx.getRequest();
        ModelTier tier = ctx.getTier();
        List<Platform> platforms = request.platformVariants().stream()
                .map(PlatformVariant::platform)
                .distinct()
                .toList();
        String prompt = promptComposer.composeCopyPrompt(request.brand(), tier, platforms, correctiveHint);

        ProviderCallResult<PostCopy> call = providerCaller.call(
                tier.providerPreferenceOrder(),
                provider -> {
                    String raw = providers.text(provider).generate(prompt);
                    try {
                        return copyResponseParser.parse(raw);
                    } catch (IllegalArgumentException e) {
                        throw new ProviderException(provider, ProviderFailure.FATAL,
                                "Unusable copy from " + provider + ": " + e.getMessage(), e);
                    }
                },
                maxAttemptsPerProvider,
                backoff,
                ctx.getCancellation());

        if (call.failedOver()) {
            metrics.recordFailover();
        }
        log.info("[Orchestrator] Copy for {} generated by {} in {} attempts",
                ctx.requestId(), call.provider(), call.attempts().size());
        return call.value();
    }

    private void reviewCopy(GenerationRunContext ctx, PostCopy firstCopy) {
        CopyReview review = review(firstCopy);
        if (review.corrupted()) {
            log.warn("[Orchestrator] Corrupted copy for {} ({}), regenerating once",
                    ctx.requestId(), review.warnings());
            metrics.recordRegeneration();
            ctx.setRegenerated(true);
            try {
                CopyReview second = review(generateCopy(ctx, CORRECTIVE_HINT));
                if (second.corrupted()) {
                    log.warn("[Orchestrator] Regenerated copy for {} still corrupted, keeping first attempt with warnings",
                            ctx.requestId());
                } else {
                    review = second;
                }
            } catch (GenerationException e) {
                log.warn("[Orchestrator] Regeneration for {} failed ({}), keeping first attempt with warnings",
                        ctx.requestId(), e.getKind());
            }
        }
        ctx.setCopy(review.copy());
        ctx.setQualityWarnings(new ArrayList<>(review.warnings()));
    }

    /**
     * Validate every field independently. Over-length fields are truncated and the truncated text is
     * checked again so corruption is still caught.
     */
    private CopyReview review(PostCopy copy) {
        Map<CopyField, String> cleaned = new EnumMap<>(CopyField.class);
        List<QualityWarning> warnings = new ArrayList<>();
        boolean corrupted = false;

        for (CopyField field : CopyField.values()) {
            String text = copy.get(field);
            if (!field.required() && (text == null || text.isBlank())) {
                continue;
            }
            TextConstraints constraints = TextConstraints.forField(field);
            ValidationVerdict verdict = outputValidator.validate(text, constraints);
            List<IssueKind> issues = new ArrayList<>(verdict.issues());
            if (verdict.has(IssueKind.OVER_LENGTH)) {
                issues.addAll(outputValidator.validate(verdict.cleanedText(), constraints).issues());
            }
            if (!issues.isEmpty()) {
                cleaned.put(field, verdict.cleanedText());
                warnings.add(new QualityWarning(field, issues));
                corrupted |= issues.contains(IssueKind.CORRUPTED_PATTERN);
            }
        }
        return new CopyReview(copy.with(cleaned), warnings, corrupted);
    }

    private record CopyReview(PostCopy copy, List<QualityWarning> warnings, boolean corrupted) {
    }

    // ===== Images =====

    private List<VariantResult> generateVariants(GenerationRunContext ctx) {
        List<PlatformVariant> variants = ctx.getRequest().platformVariants();
        if (variants.isEmpty()) {
            return List.of();
        }

        // Cancelled at the deadline so late variants start no further attempts
        CancellationSignal variantSignal = ctx.getCancellation().child();
        List<CompletableFuture<VariantResult>> futures = new ArrayList<>(variants.size());
        for (PlatformVariant variant : variants) {
            futures.add(launchVariant(ctx, variant, variantSignal));
        }

        boolean interrupted = false;
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .get(variantDeadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("[Orchestrator] Variant deadline of {}ms reached for {}", variantDeadline.toMillis(), ctx.requestId());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            interrupted = true;
            log.warn("[Orchestrator] Interrupted while waiting for variants of {}", ctx.requestId());
        } catch (ExecutionException e) {
            log.error("[Orchestrator] Variant task failed unexpectedly for {}", ctx.requestId(), e.getCause());
        } finally {
            variantSignal.cancel();
        }

        List<VariantResult> results = new ArrayList<>(variants.size());
        for (int i = 0; i < variants.size(); i++) {
            CompletableFuture<VariantResult> future = futures.get(i);
            PlatformVariant variant = variants.get(i);
            if (future.isDone() && !future.isCompletedExceptionally()) {
                results.add(future.join());
            } else if (!future.isDone()) {
                results.add(VariantResult.failure(variant,
                        interrupted ? ErrorKind.CANCELLATION_REQUESTED : ErrorKind.VARIANT_DEADLINE_EXCEEDED, 0));
            } else {
                results.add(VariantResult.failure(variant, ErrorKind.ALL_PROVIDERS_EXHAUSTED, 0));
            }
        }
        return results;
    }

    private CompletableFuture<VariantResult> launchVariant(GenerationRunContext ctx, PlatformVariant variant,
                                                           CancellationSignal signal) {
        if (signal.isCancelled()) {
            return CompletableFuture.completedFuture(
                    VariantResult.failure(variant, ErrorKind.CANCELLATION_REQUESTED, 0));
        }
        try {
            return CompletableFuture.supplyAsync(() -> generateVariant(ctx, variant, signal), generationExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("[Orchestrator] Variant {} of {} rejected by executor", variant, ctx.requestId());
            return CompletableFuture.completedFuture(
                    VariantResult.failure(variant, ErrorKind.PROVIDER_OVERLOADED, 0));
        }
    }

    private VariantResult generateVariant(GenerationRunContext ctx, PlatformVariant variant, CancellationSignal signal) {
        ModelTier tier = ctx.getTier();
        BrandContext brand = ctx.getRequest().brand();
        PostCopy copy = ctx.getCopy();
        String prompt = promptComposer.composeImagePrompt(brand, tier, variant, copy);
        ReferenceAsset reference = brand.consistency().includeLogo() && brand.hasLogo()
                && tier.supports(TierCapability.LOGO_REFERENCE)
                ? new ReferenceAsset(brand.logoUrl())
                : null;

        try {
            ProviderCallResult<GeneratedImage> call = providerCaller.call(
                    tier.providerPreferenceOrder(),
                    provider -> providers.image(provider).generate(prompt, variant.aspectRatio(), reference),
                    maxAttemptsPerProvider,
                    backoff,
                    signal);
            if (call.failedOver()) {
                metrics.recordFailover();
            }
            log.info("[Orchestrator] Variant {} {} of {} generated by {}",
                    variant.platform(), variant.aspectRatio().label(), ctx.requestId(), call.provider());
            return VariantResult.success(variant, call.value().imageUrl(), call.provider(),
                    call.attempts().size(), copy.hashtagsFor(variant.platform()));
        } catch (GenerationException e) {
            log.warn("[Orchestrator] Variant {} {} of {} failed: {}",
                    variant.platform(), variant.aspectRatio().label(), ctx.requestId(), e.getKind());
            return VariantResult.failure(variant, e.getKind(), e.getAttempts().size());
        } catch (RuntimeException e) {
            log.error("[Orchestrator] Variant {} of {} failed unexpectedly", variant, ctx.requestId(), e);
            return VariantResult.failure(variant, ErrorKind.ALL_PROVIDERS_EXHAUSTED, 0);
        }
    }

    // ===== Finalize =====

    private GenerationResult aggregate(GenerationRunContext ctx) {
        List<VariantResult> variants = ctx.getVariants();
        long succeeded = variants.stream().filter(VariantResult::succeeded).count();

        if (!variants.isEmpty() && succeeded == 0) {
            ErrorKind kind = dominantFailure(variants);
            return new GenerationResult(ctx.requestId(), GenerationStatus.FAILED, ctx.getCopy(), variants,
                    BigDecimal.ZERO, false, kind, kind.userMessage(), ctx.getQualityWarnings(), ctx.isRegenerated());
        }

        boolean partial = succeeded < variants.size();
        GenerationStatus status = partial ? GenerationStatus.PARTIALLY_COMPLETED : GenerationStatus.COMPLETED;
        return new GenerationResult(ctx.requestId(), status, ctx.getCopy(), variants,
                ctx.getAmount(), partial, null, null, ctx.getQualityWarnings(), ctx.isRegenerated());
    }

    private static ErrorKind dominantFailure(List<VariantResult> variants) {
        Set<ErrorKind> kinds = variants.stream().map(VariantResult::errorKind).collect(Collectors.toSet());
        return kinds.size() == 1 ? kinds.iterator().next() : ErrorKind.ALL_PROVIDERS_EXHAUSTED;
    }

    /**
     * Commit when the result delivers something, refund otherwise (including when no result was produced).
     */
    private void settle(GenerationRunContext ctx, GenerationResult result) {
        if (result != null && result.status() != GenerationStatus.FAILED) {
            creditMeteringService.commit(ctx.requestId());
        } else {
            if (result == null) {
                log.error("[Orchestrator] Request {} aborted in {}, refunding reservation", ctx.requestId(), ctx.getState());
            }
            creditMeteringService.refund(ctx.requestId());
        }
    }

    private GenerationResult finish(GenerationRunContext ctx, GenerationResult result) {
        ctx.transition(switch (result.status()) {
            case COMPLETED -> GenerationState.COMPLETED;
            case PARTIALLY_COMPLETED -> GenerationState.PARTIALLY_COMPLETED;
            case FAILED -> GenerationState.FAILED;
        });
        metrics.recordOutcome(result.status(), result.creditsCharged());
        log.info("[Orchestrator] Request {} finished: status={}, charged={}, variants={}/{} ok{}",
                result.requestId(), result.status(), result.creditsCharged(),
                result.succeededVariants().size(), result.variants().size(),
                result.failureKind() == null ? "" : ", failure=" + result.failureKind());
        return result;
    }
}
