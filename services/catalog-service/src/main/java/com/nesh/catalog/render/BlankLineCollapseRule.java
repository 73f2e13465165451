package com.nesh.catalog.render;

import java.util.regex.Pattern;

public class BlankLineCollapseRule implements RenderRule {
    private static final Pattern BLANK_RUN = Pattern.compile("\\n[ \\t]*\\n(?:[ \\t]*\\n)+");
    private static final Pattern TRAILING_SPACE = Pattern.compile("[ \\t]+\\n");

    @Override
    public String name() {
        return "blank_lines";
    }

    @Override
    public String apply(String text, RenderContext context) {
        String collapsed = TRAILING_SPACE.matcher(text).replaceAll("\n");
        collapsed = BLANK_RUN.matcher(collapsed).replaceAll("\n\n");
        return collapsed.strip();
    }
}
