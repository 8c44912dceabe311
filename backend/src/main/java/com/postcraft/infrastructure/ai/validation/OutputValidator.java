package com.postcraft.infrastructure.ai.validation;

import com.postcraft.domain.generation.model.IssueKind;
import com.postcraft.domain.generation.model.TextConstraints;
import com.postcraft.domain.generation.model.ValidationVerdict;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Rule-based checker for generated copy.
 * Checks, in order: empty text, word limit, corrupted patterns. Stops at the first failing rule.
 */
@Slf4j
@Component
public class OutputValidator {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // Letters outside the Latin script (Arabic, CJK, Cyrillic, ...)
    private static final Pattern NON_LATIN_LETTER = Pattern.compile("[\\p{L}&&[^\\p{IsLatin}]]");

    // Replacement character and common UTF-8-read-as-Latin-1 sequences
    private static final Pattern MOJIBAKE = Pattern.compile("\\x{FFFD}|â€|Ã[\\x{0080}-\\x{00BF}]");

    // Same letter four or more times in a row
    private static final Pattern REPEATED_LETTERS = Pattern.compile("(\\p{L})\\1{3,}", Pattern.CASE_INSENSITIVE);

    private static final Pattern VOWEL = Pattern.compile("[aeiouyAEIOUY]");
    private static final int MIN_VOWELLESS_TOKEN_LENGTH = 5;

    private final List<Pattern> corruptedTokens;

    public OutputValidator(
            @Value("${generation.validation.corrupted-tokens:AUTTENG,BAMALE,COMEASUE}") List<String> corruptedTokens) {
        this.corruptedTokens = corruptedTokens.stream()
                .filter(t -> !t.isBlank())
                .map(t -> Pattern.compile(Pattern.quote(t.trim()), Pattern.CASE_INSENSITIVE))
                .toList();
    }

    /**
     * Validate one text field.
     *
     * @param text        generated text, may be null
     * @param constraints limits for the field
     * @return verdict whose cleaned text is the input unless it had to be truncated
     */
    public ValidationVerdict validate(String text, TextConstraints constraints) {
        if (text == null || text.isBlank()) {
            return invalid(text == null ? "" : text, IssueKind.EMPTY_TEXT);
        }

        String[] words = WHITESPACE.split(text.trim());
        if (words.length > constraints.maxWords()) {
            String truncated = String.join(" ", Arrays.copyOf(words, constraints.maxWords()));
            log.debug("[Validator] Truncated {} words to {}", words.length, constraints.maxWords());
            return invalid(truncated, IssueKind.OVER_LENGTH);
        }

        Optional<String> corruption = findCorruption(text, words, constraints);
        if (corruption.isPresent()) {
            log.debug("[Validator] Corrupted pattern detected: {}", corruption.get());
            return invalid(text, IssueKind.CORRUPTED_PATTERN);
        }

        return new ValidationVerdict(true, text, List.of());
    }

    private Optional<String> findCorruption(String text, String[] words, TextConstraints constraints) {
        for (Pattern token : corruptedTokens) {
            if (token.matcher(text).find()) {
                return Optional.of("known token " + token.pattern());
            }
        }
        for (Pattern forbidden : constraints.forbidPatterns()) {
            if (forbidden.matcher(text).find()) {
                return Optional.of("forbidden pattern " + forbidden.pattern());
            }
        }
        if (!constraints.requireEnglishWords()) {
            return Optional.empty();
        }
        if (NON_LATIN_LETTER.matcher(text).find()) {
            return Optional.of("non-Latin letters");
        }
        if (MOJIBAKE.matcher(text).find()) {
            return Optional.of("encoding debris");
        }
        if (REPEATED_LETTERS.matcher(text).find()) {
            return Optional.of("repeated letters");
        }
        for (String word : words) {
            String letters = word.replaceAll("[^\\p{L}]", "");
            if (letters.length() >= MIN_VOWELLESS_TOKEN_LENGTH
                    && letters.length() == word.replaceAll("[^\\p{L}\\p{N}]", "").length()
                    && !VOWEL.matcher(letters).find()) {
                return Optional.of("unpronounceable token " + word);
            }
        }
        return Optional.empty();
    }

    private static ValidationVerdict invalid(String cleanedText, IssueKind issue) {
        return new ValidationVerdict(false, cleanedText, List.of(issue));
    }
}
