package com.nesh.catalog.index;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

public final class TextNormalizer {
    private static final Pattern MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");

    private TextNormalizer() {
    }

    /**
     * Lower-cases, strips accents and collapses everything that is not a letter or digit to one space.
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String decomposed = Normalizer.normalize(text.toLowerCase(Locale.ROOT), Normalizer.Form.NFD);
        String plain = MARKS.matcher(decomposed).replaceAll("");
        return NON_ALNUM.matcher(plain).replaceAll(" ").trim();
    }

    public static List<String> tokens(String normalized) {
        if (normalized == null || normalized.isEmpty()) {
            return List.of();
        }
        return List.of(normalized.split(" "));
    }

    /**
     * Distinct query terms without stopwords; keeps the stopwords when nothing else is left.
     */
    public static List<String> terms(String normalized, Collection<String> stopwords) {
        Set<String> all = new LinkedHashSet<>(tokens(normalized));
        List<String> kept = new ArrayList<>(all.size());
        for (String token : all) {
            if (stopwords == null || !stopwords.contains(token)) {
                kept.add(token);
            }
        }
        return kept.isEmpty() ? new ArrayList<>(all) : kept;
    }
}
