package com.nesh.catalog.render;

import java.util.ArrayList;
import java.util.List;

/**
 * Wraps runs of text lines in {@code <p>}, joining lines with {@code <br>}. Headings and lists stand alone.
 */
public class ParagraphRule implements RenderRule {

    @Override
    public String name() {
        return "paragraphs";
    }

    @Override
    public String apply(String text, RenderContext context) {
        if (text.isEmpty()) {
            return text;
        }
        List<String> blocks = new ArrayList<>();
        List<String> paragraph = new ArrayList<>();
        for (String line : text.split("\n", -1)) {
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                flush(paragraph, blocks);
            } else if (isBlock(trimmed)) {
                flush(paragraph, blocks);
                blocks.add(trimmed);
            } else {
                paragraph.add(trimmed);
            }
        }
        flush(paragraph, blocks);
        return String.join("\n", blocks);
    }

    private boolean isBlock(String line) {
        return line.startsWith("<h3 ") || line.startsWith("<h4 ") || line.startsWith("<ol");
    }

    private void flush(List<String> paragraph, List<String> blocks) {
        if (paragraph.isEmpty()) {
            return;
        }
        blocks.add("<p>" + String.join("<br>", paragraph) + "</p>");
        paragraph.clear();
    }
}
