package com.nesh.catalog.render;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the bracketed exponents left by PDF extraction ({@code m [2]}, {@code cm[3]}) into
 * {@code ²} and {@code ³}.
 */
public class SuperscriptRule implements RenderRule {
    private static final Pattern BRACKETED_EXPONENT = Pattern.compile("[ \\t]?\\[[ \\t]*([23])[ \\t]*\\]");

    @Override
    public String name() {
        return "superscripts";
    }

    @Override
    public String apply(String text, RenderContext context) {
        Matcher matcher = BRACKETED_EXPONENT.matcher(text);
        StringBuilder builder = new StringBuilder(text.length());
        while (matcher.find()) {
            matcher.appendReplacement(builder, "2".equals(matcher.group(1)) ? "²" : "³");
        }
        matcher.appendTail(builder);
        return builder.toString();
    }
}
