package com.nesh.catalog.render;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Drops whole lines matching any of the given patterns.
 */
public class LineFilterRule implements RenderRule {
    private final String name;
    private final List<Pattern> patterns;

    public LineFilterRule(String name, List<Pattern> patterns) {
        this.name = name;
        this.patterns = List.copyOf(patterns);
    }

    public static LineFilterRule pageMarkers() {
        return new LineFilterRule("page_markers", List.of(
            Pattern.compile("^\\s*P[áa]gina\\s+\\d+\\s*$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^\\s*Page\\s+\\d+\\s*$", Pattern.CASE_INSENSITIVE)
        ));
    }

    public static LineFilterRule structuralArtifacts() {
        return new LineFilterRule("structural_artifacts", List.of(
            Pattern.compile("^\\s*[IVXLC]+-\\d{4}-\\d+\\s*$"),
            Pattern.compile("^\\s*(?:\\*\\*|\\*)?\\d{2}\\.\\d{2}(?:\\.\\d{2})?(?:\\*\\*|\\*)?\\s*$"),
            Pattern.compile("^\\s*-\\s*\\*?\\s*$"),
            Pattern.compile("^\\s*\\*+\\s*$")
        ));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String apply(String text, RenderContext context) {
        String[] lines = text.split("\n", -1);
        StringBuilder builder = new StringBuilder(text.length());
        boolean first = true;
        for (String line : lines) {
            if (matchesAny(line)) {
                continue;
            }
            if (!first) {
                builder.append('\n');
            }
            builder.append(line);
            first = false;
        }
        return builder.toString();
    }

    private boolean matchesAny(String line) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(line).matches()) {
                return true;
            }
        }
        return false;
    }
}
