package com.postcraft.infrastructure.ai.prompt;

import com.postcraft.domain.generation.model.BrandConsistency;
import com.postcraft.domain.generation.model.BrandContext;
import com.postcraft.domain.generation.model.BusinessType;
import com.postcraft.domain.generation.model.ContactInfo;
import com.postcraft.domain.generation.model.CopyField;
import com.postcraft.domain.generation.model.ModelTier;
import com.postcraft.domain.generation.model.Platform;
import com.postcraft.domain.generation.model.PlatformVariant;
import com.postcraft.domain.generation.model.PostCopy;
import com.postcraft.domain.generation.model.TierCapability;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Renders provider prompts from brand context and tier. Output depends only on the arguments.
 */
@Component
public class PromptComposer {

    private static final Map<BusinessType, String> BUSINESS_STYLES = new EnumMap<>(Map.ofEntries(
            Map.entry(BusinessType.RESTAURANT, "Appetizing and warm. Lead with the food, the atmosphere and the people."),
            Map.entry(BusinessType.RETAIL, "Product-forward and energetic. Highlight what is new, seasonal or limited."),
            Map.entry(BusinessType.FINANCE, "Clear, calm and trustworthy. No hype, no guarantees of returns."),
            Map.entry(BusinessType.TECHNOLOGY, "Crisp and modern. Explain the benefit, not the specification sheet."),
            Map.entry(BusinessType.HEALTH, "Caring and reassuring. Avoid medical claims or promises of outcomes."),
            Map.entry(BusinessType.BEAUTY, "Elegant and aspirational. Focus on confidence and self-care."),
            Map.entry(BusinessType.FITNESS, "Motivating and direct. Speak to progress and community."),
            Map.entry(BusinessType.EDUCATION, "Encouraging and credible. Focus on growth and outcomes for learners."),
            Map.entry(BusinessType.REAL_ESTATE, "Inviting and aspirational. Sell the lifestyle as well as the property."),
            Map.entry(BusinessType.PROFESSIONAL_SERVICES, "Confident and expert. Emphasise reliability and results.")
    ));

    private static final String DEFAULT_BUSINESS_STYLE = "Friendly, professional and specific to this business.";

    private static final String READABILITY_BLOCK = """

            ## Language and readability
            - ALL text must be in clear, readable ENGLISH only.
            - No foreign languages, transliterations or made-up words.
            - No corrupted characters, symbols, accents or diacritical marks.
            - Every word must be a real, correctly spelled English word.""";

    // ===== Copy task =====

    public String composeCopyPrompt(BrandContext brand, ModelTier tier, List<Platform> platforms, String correctiveHint) {
        List<Platform> targets = platforms.isEmpty() ? List.of(Platform.INSTAGRAM) : platforms;
        StringBuilder sb = new StringBuilder();
        appendCommon(sb, brand, tier, targets);
        sb.append(READABILITY_BLOCK);

        int hashtags = targets.stream().mapToInt(Platform::maxHashtags).max().orElse(Platform.INSTAGRAM.maxHashtags());
        sb.append("\n\n## Output contract\n");
        sb.append("Write one social media post for this business. Respond with a single JSON object with these keys:\n");
        for (CopyField field : CopyField.values()) {
            sb.append("- \"").append(field.jsonKey()).append("\": string, at most ")
                    .append(field.maxWords()).append(" words")
                    .append(field.required() ? "" : " (may be empty)")
                    .append('\n');
        }
        sb.append("- \"hashtags\": array of at most ").append(hashtags)
                .append(" hashtags, each starting with #\n");
        sb.append("Output the JSON object only, with no commentary before or after it.");

        appendHint(sb, correctiveHint);
        return sb.toString();
    }

    // ===== Image task =====

    public String composeImagePrompt(BrandContext brand, ModelTier tier, PlatformVariant variant, PostCopy copy) {
        StringBuilder sb = new StringBuilder();
        appendCommon(sb, brand, tier, List.of(variant.platform()));

        sb.append("\n\n## Format\n");
        sb.append("Aspect ratio ").append(variant.aspectRatio().label()).append('.');
        if (tier.supports(TierCapability.HD_RENDERING)) {
            sb.append(" Render in high definition with sharp, clean details.");
        }

        BrandConsistency consistency = brand.consistency();
        if (consistency.includeLogo() && brand.hasLogo() && tier.supports(TierCapability.LOGO_REFERENCE)) {
            sb.append("\n\n## Logo\n");
            sb.append("Integrate the supplied brand logo naturally into the design (on a product, a sign or as a subtle watermark).");
        }

        sb.append(READABILITY_BLOCK);

        String targetText = imageText(copy);
        sb.append("\n\n## Text overlay\n");
        if (targetText.isEmpty()) {
            sb.append("No text should be added to the image.");
        } else {
            sb.append("Overlay ONLY the following text, exactly as written: \"").append(targetText).append("\"\n");
            sb.append("Do not add any other text. Make it large, bold and high-contrast for mobile readability.");
        }
        return sb.toString();
    }

    private void appendCommon(StringBuilder sb, BrandContext brand, ModelTier tier, List<Platform> platforms) {
        sb.append("## Quality level: ").append(tier.displayName()).append('\n');
        for (String directive : tier.promptDirectives()) {
            sb.append("- ").append(directive).append('\n');
        }

        sb.append("\n## Business\n");
        sb.append("Name: ").append(brand.businessName()).append('\n');
        appendIfPresent(sb, "Location", brand.location());
        appendIfPresent(sb, "Target audience", brand.targetAudience());
        sb.append("Style: ").append(BUSINESS_STYLES.getOrDefault(brand.businessType(), DEFAULT_BUSINESS_STYLE)).append('\n');

        List<String> brandLines = brandInstructions(brand);
        if (!brandLines.isEmpty()) {
            sb.append("\n## Brand consistency\n");
            for (String line : brandLines) {
                sb.append("- ").append(line).append('\n');
            }
        }

        sb.append("\n## Platform\n");
        for (Platform platform : platforms) {
            sb.append("- ").append(platformGuidance(platform)).append('\n');
        }
    }

    static String platformGuidance(Platform platform) {
        return switch (platform) {
            case INSTAGRAM -> "Instagram: visual-first, short punchy lines, hashtags at the end.";
            case FACEBOOK -> "Facebook: conversational, community-oriented, invite comments.";
            case LINKEDIN -> "LinkedIn: professional tone, value-focused, few hashtags.";
            case TWITTER -> "Twitter: very concise, one idea per post, at most two hashtags.";
            case TIKTOK -> "TikTok: playful and trend-aware, vertical framing, hook in the first line.";
        };
    }

    private List<String> brandInstructions(BrandContext brand) {
        BrandConsistency consistency = brand.consistency();
        List<String> lines = new ArrayList<>();
        if (consistency.useBrandVoice() && hasText(brand.brandVoice())) {
            lines.add("Write in this brand voice: " + brand.brandVoice());
        }
        if (consistency.followBrandColors() && hasText(brand.primaryColor())) {
            String colors = hasText(brand.accentColor())
                    ? brand.primaryColor() + " (primary) and " + brand.accentColor() + " (accent)"
                    : brand.primaryColor() + " (primary)";
            lines.add("Use the brand colors " + colors + ".");
        }
        ContactInfo contacts = brand.contactInfo();
        if (consistency.includeContacts() && contacts != null && !contacts.isEmpty()) {
            lines.add("Include these contact details where natural: " + contactLine(contacts));
        }
        return lines;
    }

    private static String contactLine(ContactInfo contacts) {
        List<String> parts = new ArrayList<>();
        if (hasText(contacts.phone())) parts.add("phone " + contacts.phone());
        if (hasText(contacts.email())) parts.add("email " + contacts.email());
        if (hasText(contacts.website())) parts.add("website " + contacts.website());
        if (hasText(contacts.address())) parts.add("address " + contacts.address());
        return String.join(", ", parts);
    }

    private static String imageText(PostCopy copy) {
        if (copy == null) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        if (hasText(copy.headline())) parts.add(copy.headline().trim());
        if (hasText(copy.callToAction())) parts.add(copy.callToAction().trim());
        return String.join(" - ", parts);
    }

    private static void appendHint(StringBuilder sb, String hint) {
        if (hasText(hint)) {
            sb.append("\n\n## Correction\n").append(hint);
        }
    }

    private static void appendIfPresent(StringBuilder sb, String label, String value) {
        if (hasText(value)) {
            sb.append(label).append(": ").append(value).append('\n');
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
