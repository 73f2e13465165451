package com.nesh.catalog.render;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Groups consecutive enumerated lines ({@code a) ...}, {@code 1. ...}, {@code II) ...}) into an
 * ordered list. A line of another kind, a blank line or a change of marker style closes the list.
 */
public class ListRule implements RenderRule {
    private static final Pattern LETTER_ITEM = Pattern.compile("^[a-z]\\)\\s+(.+)$");
    private static final Pattern NUMBER_ITEM = Pattern.compile("^\\d+[.)]\\s+(.+)$");
    private static final Pattern ROMAN_ITEM = Pattern.compile("^[IVX]+[.)]\\s+(.+)$");

    @Override
    public String name() {
        return "lists";
    }

    @Override
    public String apply(String text, RenderContext context) {
        String[] lines = text.split("\n", -1);
        List<String> out = new ArrayList<>(lines.length);
        List<String> items = new ArrayList<>();
        String listType = null;
        for (String line : lines) {
            String trimmed = line.strip();
            String[] item = matchItem(trimmed);
            if (item == null) {
                flush(items, listType, out);
                listType = null;
                out.add(line);
                continue;
            }
            if (listType != null && !listType.equals(item[0])) {
                flush(items, listType, out);
            }
            listType = item[0];
            items.add("<li>" + item[1] + "</li>");
        }
        flush(items, listType, out);
        return String.join("\n", out);
    }

    private String[] matchItem(String line) {
        Matcher matcher = LETTER_ITEM.matcher(line);
        if (matcher.matches()) {
            return new String[] {"a", matcher.group(1)};
        }
        matcher = NUMBER_ITEM.matcher(line);
        if (matcher.matches()) {
            return new String[] {"1", matcher.group(1)};
        }
        matcher = ROMAN_ITEM.matcher(line);
        if (matcher.matches()) {
            return new String[] {"I", matcher.group(1)};
        }
        return null;
    }

    private void flush(List<String> items, String listType, List<String> out) {
        if (items.isEmpty()) {
            return;
        }
        String typeAttribute = "1".equals(listType) ? "" : " type=\"" + listType + "\"";
        out.add("<ol" + typeAttribute + " class=\"list\">" + String.join("", items) + "</ol>");
        items.clear();
    }
}
