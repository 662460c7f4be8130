package com.lineguard.pipeline;

import com.lineguard.common.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Cheap screening of an item's name and description before the catalog is consulted. Rule checks
 * (length, numbers-only, symbols-only, blacklisted and inappropriate terms) run first, then structural
 * checks for vague or garbled names; either can reject. Otherwise allowlisted patterns and material
 * keywords approve, and anything else needs review.
 */
@Component
@Slf4j
public class PreValidator {

    static final double REJECT_SCORE = 0.95;
    static final double ALLOWLIST_SCORE = 0.9;
    static final double KEYWORD_BASE_SCORE = 0.7;
    static final double KEYWORD_STEP = 0.1;
    static final double KEYWORD_MAX_SCORE = 0.95;
    static final double REVIEW_SCORE = 0.5;

    private static final Pattern NUMERIC_ONLY = Pattern.compile("^\\d+[\\s\\-._]*\\d*$");
    private static final Pattern REPEATED_CHARACTER = Pattern.compile("(.)\\1{4,}");
    private static final Pattern LONG_DIGIT_RUN = Pattern.compile("\\d{8,}");
    private static final Pattern SYMBOL_RUN = Pattern.compile("[!@#$%^&*()]{3,}");
    private static final Pattern LETTERS_ONLY = Pattern.compile("\\p{L}{5,}");
    private static final Pattern VOWEL = Pattern.compile("[aeiouyàâäéèêëîïôöùûüáíóú]");

    private final PipelineProperties.PreValidation settings;
    private final List<TermPattern> blacklisted;
    private final List<TermPattern> inappropriate;
    private final List<Pattern> allowlist;
    private final List<TermPattern> materialKeywords;

    public PreValidator(PipelineProperties properties) {
        this.settings = properties.getPreValidation();
        this.blacklisted = TermPattern.all(settings.getBlacklistedTerms());
        this.inappropriate = TermPattern.all(settings.getInappropriateTerms());
        this.allowlist = settings.getAllowlistPatterns().stream()
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
                .toList();
        this.materialKeywords = TermPattern.all(settings.getMaterialKeywords());
    }

    public boolean isEnabled() {
        return settings.isEnabled();
    }

    public PreValidationResult check(String name, String description) {
        String normalizedName = TextNormalizer.normalize(name);
        String normalizedDescription = TextNormalizer.normalize(description);
        String text = normalizedDescription.isEmpty() ? normalizedName : normalizedName + " " + normalizedDescription;

        Optional<PreValidationResult> rejection = ruleRejection(normalizedName, text)
                .or(() -> structuralRejection(normalizedName));
        if (rejection.isPresent()) {
            log.debug("Pre-validation: rejecting item '{}' ({})", name, rejection.get().reasons());
            return rejection.get();
        }

        for (Pattern pattern : allowlist) {
            if (pattern.matcher(text).find()) {
                return new PreValidationResult(PreValidationResult.Verdict.APPROVED, ALLOWLIST_SCORE,
                        List.of("Matches allowlisted pattern " + pattern.pattern()), null);
            }
        }
        List<String> keywords = materialKeywords.stream()
                .filter(k -> k.foundIn(text))
                .map(TermPattern::term)
                .toList();
        if (!keywords.isEmpty()) {
            double score = Math.min(KEYWORD_BASE_SCORE + KEYWORD_STEP * keywords.size(), KEYWORD_MAX_SCORE);
            return new PreValidationResult(PreValidationResult.Verdict.APPROVED, score,
                    List.of("Material keywords: " + String.join(", ", keywords)), null);
        }
        return new PreValidationResult(PreValidationResult.Verdict.NEEDS_REVIEW, REVIEW_SCORE,
                List.of("No rule applies; needs review"), null);
    }

    private Optional<PreValidationResult> ruleRejection(String name, String text) {
        if (name.length() < settings.getMinNameLength()) {
            return Optional.of(PreValidationResult.rejected("Name shorter than " + settings.getMinNameLength() + " characters"));
        }
        if (NUMERIC_ONLY.matcher(name).matches()) {
            return Optional.of(PreValidationResult.rejected("Name is only numbers"));
        }
        if (name.codePoints().filter(Character::isLetterOrDigit).count() < 2) {
            return Optional.of(PreValidationResult.rejected("Name is mostly symbols"));
        }
        for (TermPattern term : blacklisted) {
            if (term.foundIn(text)) {
                return Optional.of(PreValidationResult.blacklisted(term.term()));
            }
        }
        for (TermPattern term : inappropriate) {
            if (term.foundIn(text)) {
                return Optional.of(PreValidationResult.rejected("Inappropriate language"));
            }
        }
        return Optional.empty();
    }

    private Optional<PreValidationResult> structuralRejection(String name) {
        List<String> tokens = TextNormalizer.tokens(name);
        if (tokens.size() == 1 && settings.getGenericTerms().contains(tokens.get(0))) {
            return Optional.of(PreValidationResult.rejected("Name is a single generic term: " + tokens.get(0)));
        }
        if (REPEATED_CHARACTER.matcher(name).find()) {
            return Optional.of(PreValidationResult.rejected("Name repeats one character five or more times"));
        }
        if (LONG_DIGIT_RUN.matcher(name).find()) {
            return Optional.of(PreValidationResult.rejected("Name contains a run of eight or more digits"));
        }
        if (SYMBOL_RUN.matcher(name).find()) {
            return Optional.of(PreValidationResult.rejected("Name contains a run of special characters"));
        }
        for (String token : tokens) {
            if (LETTERS_ONLY.matcher(token).matches() && !VOWEL.matcher(token).find()) {
                return Optional.of(PreValidationResult.rejected("Name looks like gibberish: " + token));
            }
        }
        return Optional.empty();
    }

    /**
     * A configured term matched as a whole word: not preceded or followed by a letter or digit.
     */
    private record TermPattern(String term, Pattern pattern) {

        static List<TermPattern> all(List<String> terms) {
            return terms.stream()
                    .filter(t -> t != null && !t.isBlank())
                    .map(t -> t.strip().toLowerCase(Locale.ROOT))
                    .distinct()
                    .map(t -> new TermPattern(t, Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(t) + "(?![\\p{L}\\p{N}])")))
                    .toList();
        }

        boolean foundIn(String text) {
            return pattern.matcher(text).find();
        }
    }
}
