package com.nesh.catalog.render;

import java.util.regex.Pattern;

/**
 * Replaces the {@code (+)} marker, which flags positions that have subposition explanatory notes,
 * with an indicator element.
 */
public class SubpositionMarkerRule implements RenderRule {
    static final String INDICATOR =
        "<span class=\"subpos-indicator\" title=\"Existe Nota Explicativa de subposição\">†</span>";

    private static final Pattern MARKER = Pattern.compile("[ \\t]*\\(\\+\\)");

    @Override
    public String name() {
        return "subposition_markers";
    }

    @Override
    public String apply(String text, RenderContext context) {
        return MARKER.matcher(text).replaceAll(" " + INDICATOR);
    }
}
