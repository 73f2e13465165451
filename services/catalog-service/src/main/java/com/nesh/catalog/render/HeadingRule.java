package com.nesh.catalog.render;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tags heading lines ({@code 84.13 - Bombas}, {@code **84.13** – ...}, {@code 8413.11: ...}) with
 * the position anchor. An anchor is emitted once per chapter; later repeats stay as plain text.
 */
public class HeadingRule implements RenderRule {
    private static final Pattern HEADING = Pattern.compile(
        "^\\s*(?:\\*\\*|\\*)?(\\d{2}\\.\\d{2}|\\d{4}\\.\\d{1,2}(?:\\.\\d{2})?)(?:\\*\\*|\\*)?"
            + "\\s*[-\u2013\u2014:]\\s*(?:\\*\\*|\\*)?(.+?)(?:\\*\\*|\\*)?\\s*$"
    );

    @Override
    public String name() {
        return "headings";
    }

    @Override
    public String apply(String text, RenderContext context) {
        String[] lines = text.split("\n", -1);
        StringBuilder builder = new StringBuilder(text.length() + 256);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                builder.append('\n');
            }
            builder.append(renderLine(lines[i], context));
        }
        return builder.toString();
    }

    private String renderLine(String line, RenderContext context) {
        Matcher matcher = HEADING.matcher(line);
        if (!matcher.matches()) {
            return line;
        }
        String code = matcher.group(1);
        String description = matcher.group(2).trim();
        String anchor = context.anchorFor(code);
        if (anchor == null || !context.claimAnchor(anchor)) {
            return line;
        }
        boolean position = code.length() == 5;
        String tag = position ? "h3" : "h4";
        String cssClass = position ? "position" : "subposition";
        return "<" + tag + " class=\"" + cssClass + "\" id=\"" + anchor + "\">"
            + "<span class=\"code\">" + code + "</span> - " + description
            + "</" + tag + ">";
    }
}
