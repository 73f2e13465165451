package com.nesh.catalog.query;

/**
 * One code-shaped fragment of a query. {@code raw} is the fragment exactly as typed (trimmed),
 * {@code code} is the numeric part without any exception marker.
 */
public record CodeToken(String raw, String code, Integer exceptionIndex) {

    public String digits() {
        return CodeFormats.clean(code);
    }

    public String chapter() {
        return CodeFormats.chapterOf(digits());
    }

    public boolean isException() {
        return exceptionIndex != null;
    }
}
