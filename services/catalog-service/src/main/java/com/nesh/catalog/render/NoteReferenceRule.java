package com.nesh.catalog.render;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Links "Note 3", "Notes 1, 2, and 4", "Notas 2, 3 e 5" to the chapter's notes. Numbers missing from
 * the chapter's notes and references qualified with another chapter are left as written.
 */
public class NoteReferenceRule implements RenderRule {
    private static final Pattern REFERENCE = Pattern.compile(
        "\\b(notes?|notas?)(\\s+)(\\d+(?:\\s*,\\s*(?:(?:and|or|e|ou)\\s+)?\\d+|\\s+(?:and|or|e|ou)\\s+\\d+)*)"
            + "(\\s+(?:of|to|do|da|de)\\s+(?:the\\s+|o\\s+)?(?:chapter|cap[ií]tulo)\\s+(\\d{1,2})\\b)?",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
    );
    private static final Pattern NUMBER = Pattern.compile("\\d+");

    @Override
    public String name() {
        return "note_references";
    }

    @Override
    public String apply(String text, RenderContext context) {
        Matcher matcher = REFERENCE.matcher(text);
        StringBuilder builder = new StringBuilder(text.length() + 128);
        while (matcher.find()) {
            String replacement = matcher.group(0);
            String qualifiedChapter = matcher.group(5);
            if (qualifiedChapter == null || isSameChapter(qualifiedChapter, context.getChapter())) {
                replacement = matcher.group(1) + matcher.group(2) + linkNumbers(matcher.group(3), context)
                    + (matcher.group(4) == null ? "" : matcher.group(4));
            }
            matcher.appendReplacement(builder, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(builder);
        return builder.toString();
    }

    private String linkNumbers(String numbers, RenderContext context) {
        Matcher matcher = NUMBER.matcher(numbers);
        StringBuilder builder = new StringBuilder(numbers.length() + 96);
        while (matcher.find()) {
            String number = stripLeadingZeros(matcher.group());
            String replacement = matcher.group();
            if (context.hasNote(number)) {
                context.markNoteReferenced(number);
                replacement = "<a class=\"note-ref\" href=\"#chapter-" + context.getChapter() + "-note-" + number
                    + "\" data-note=\"" + number + "\">" + matcher.group() + "</a>";
            }
            matcher.appendReplacement(builder, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(builder);
        return builder.toString();
    }

    private boolean isSameChapter(String qualified, String chapter) {
        return chapter != null && stripLeadingZeros(qualified).equals(stripLeadingZeros(chapter));
    }

    private String stripLeadingZeros(String value) {
        int i = 0;
        while (i < value.length() - 1 && value.charAt(i) == '0') {
            i++;
        }
        return value.substring(i);
    }
}
