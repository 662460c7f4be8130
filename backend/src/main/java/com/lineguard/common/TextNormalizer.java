package com.lineguard.common;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form for free-text item names: NFKC, trimmed, leading list markers removed,
 * whitespace collapsed, case-folded. Catalog names, synonyms and invoice lines all go through here
 * so exact lookups compare like with like.
 */
public final class TextNormalizer {

    private static final Pattern LIST_MARKER = Pattern.compile("^(?:\\d+[.)]\\s+|[-*•]\\s*)+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");

    private TextNormalizer() {
    }

    /**
     * Returns the normalized form, or an empty string for null/blank input.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String s = Normalizer.normalize(text, Normalizer.Form.NFKC).strip();
        s = LIST_MARKER.matcher(s).replaceFirst("");
        s = WHITESPACE.matcher(s).replaceAll(" ").strip();
        return s.toLowerCase(Locale.ROOT);
    }

    /**
     * Splits already-normalized text into alphanumeric tokens.
     */
    public static List<String> tokens(String normalized) {
        if (normalized == null || normalized.isBlank()) {
            return List.of();
        }
        return Arrays.stream(TOKEN_SEPARATOR.split(normalized))
                .filter(t -> !t.isEmpty())
                .toList();
    }
}
