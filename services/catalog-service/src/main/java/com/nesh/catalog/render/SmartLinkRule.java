package com.nesh.catalog.render;

import com.nesh.catalog.query.CodeFormats;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Links tariff codes mentioned in running text ({@code 73.15}, {@code 8419.8}, {@code 8413.11.00})
 * to their position anchor. Text inside tags, existing links and heading code spans is left alone.
 */
public class SmartLinkRule implements RenderRule {
    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern CODE = Pattern.compile(
        "\\b(\\d{4}\\.\\d{2}\\.\\d{2}|\\d{2}\\.\\d{2}(?:\\.\\d{2}\\.\\d{2})?|\\d{4}\\.\\d{1,2})\\b"
    );

    @Override
    public String name() {
        return "smart_links";
    }

    @Override
    public String apply(String text, RenderContext context) {
        Matcher tags = TAG.matcher(text);
        StringBuilder builder = new StringBuilder(text.length() + 256);
        int skipDepth = 0;
        int last = 0;
        while (tags.find()) {
            appendSegment(builder, text.substring(last, tags.start()), skipDepth > 0, context);
            String tag = tags.group();
            builder.append(tag);
            skipDepth = nextDepth(tag, skipDepth);
            last = tags.end();
        }
        appendSegment(builder, text.substring(last), skipDepth > 0, context);
        return builder.toString();
    }

    private int nextDepth(String tag, int depth) {
        if (tag.startsWith("</")) {
            return depth > 0 ? depth - 1 : 0;
        }
        if (tag.endsWith("/>") || isVoid(tag)) {
            return depth;
        }
        if (depth > 0) {
            return depth + 1;
        }
        return opensSkippedElement(tag) ? 1 : 0;
    }

    private boolean opensSkippedElement(String tag) {
        String lower = tag.toLowerCase(Locale.ROOT);
        return lower.startsWith("<a ") || lower.equals("<a>")
            || lower.contains("class=\"code\"") || lower.contains("smart-link");
    }

    private boolean isVoid(String tag) {
        String lower = tag.toLowerCase(Locale.ROOT);
        return lower.startsWith("<br") || lower.startsWith("<hr") || lower.startsWith("<img");
    }

    private void appendSegment(StringBuilder builder, String segment, boolean skip, RenderContext context) {
        if (segment.isEmpty()) {
            return;
        }
        if (skip) {
            builder.append(segment);
            return;
        }
        Matcher matcher = CODE.matcher(segment);
        while (matcher.find()) {
            String code = matcher.group(1);
            String anchor = context.anchorFor(code);
            String link = "<a class=\"smart-link\" href=\"#" + anchor + "\" data-ncm=\"" + CodeFormats.clean(code) + "\">"
                + code + "</a>";
            matcher.appendReplacement(builder, Matcher.quoteReplacement(link));
        }
        matcher.appendTail(builder);
    }
}
