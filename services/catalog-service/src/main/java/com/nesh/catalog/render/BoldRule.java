package com.nesh.catalog.render;

import java.util.regex.Pattern;

public class BoldRule implements RenderRule {
    private static final Pattern BOLD = Pattern.compile("\\*\\*(.+?)\\*\\*");

    @Override
    public String name() {
        return "bold";
    }

    @Override
    public String apply(String text, RenderContext context) {
        return BOLD.matcher(text).replaceAll("<strong>$1</strong>");
    }
}
