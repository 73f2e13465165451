package com.nesh.catalog.catalog;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Splits the chapter preamble (everything before the first position heading) into title, notes,
 * general considerations and numbered definitions.
 */
@Component
public class ChapterSectionExtractor {
    private static final Pattern CHAPTER_HEADER = Pattern.compile(
        "^(?:\\*\\*)?Cap[ií]tulo\\s+\\d+(?:\\*\\*)?$",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
    );
    private static final Pattern FIRST_POSITION = Pattern.compile("^\\*?\\*?\\d{2}\\.\\d{2}\\*?\\*?\\s*[-–—]");
    private static final Pattern NOTES_HEADER = Pattern.compile("^Notas?\\.?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONSIDERATIONS_HEADER = Pattern.compile(
        "^CONSIDERA[ÇC][ÕO]ES GERAIS",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
    );
    private static final Pattern DEFINITION_ITEM = Pattern.compile("^\\d+\\)");
    private static final Pattern LOWERCASE_START = Pattern.compile("^[a-zà-ÿ]");
    private static final Pattern BOLD = Pattern.compile("\\*\\*(.+?)\\*\\*");
    private static final Pattern ITALIC = Pattern.compile("\\*(.+?)\\*");
    private static final Pattern UNDERSCORE = Pattern.compile("_(.+?)_");
    private static final Pattern EXCESS_BLANK = Pattern.compile("\\n{3,}");

    private enum Section {
        TITLE,
        NOTES,
        CONSIDERATIONS,
        DEFINITIONS
    }

    public ChapterSections extract(String content) {
        if (content == null || content.isBlank()) {
            return ChapterSections.empty();
        }
        Map<Section, List<String>> lines = new EnumMap<>(Section.class);
        for (Section section : Section.values()) {
            lines.put(section, new ArrayList<>());
        }
        Section current = Section.TITLE;
        boolean titleCaptured = false;
        String lastDefinition = "";

        for (String line : content.replace("\r\n", "\n").split("\n", -1)) {
            String stripped = line.strip();
            boolean indented = !line.isEmpty() && Character.isWhitespace(line.charAt(0));
            if (CHAPTER_HEADER.matcher(stripped).matches()) {
                continue;
            }
            if (FIRST_POSITION.matcher(stripped).find()) {
                break;
            }
            if (!titleCaptured && stripped.isEmpty()) {
                continue;
            }
            String cleaned = cleanMarkdown(stripped);
            if (NOTES_HEADER.matcher(cleaned).matches()) {
                titleCaptured = true;
                current = Section.NOTES;
                continue;
            }
            if (CONSIDERATIONS_HEADER.matcher(cleaned).find()) {
                current = Section.CONSIDERATIONS;
                continue;
            }
            if (current == Section.CONSIDERATIONS && DEFINITION_ITEM.matcher(cleaned).find()) {
                current = Section.DEFINITIONS;
                lines.get(current).add(cleaned);
                lastDefinition = cleaned;
                continue;
            }
            if (current == Section.DEFINITIONS && !cleaned.isEmpty()) {
                if (DEFINITION_ITEM.matcher(cleaned).find() || isContinuation(cleaned, indented, lastDefinition)) {
                    lines.get(current).add(cleaned);
                    lastDefinition = cleaned;
                    continue;
                }
                current = Section.CONSIDERATIONS;
            }
            if (!titleCaptured && !cleaned.isEmpty()) {
                lines.get(Section.TITLE).add(cleaned);
                titleCaptured = true;
                continue;
            }
            lines.get(current).add(cleaned);
        }

        return new ChapterSections(
            join(lines.get(Section.TITLE)),
            join(lines.get(Section.NOTES)),
            join(lines.get(Section.CONSIDERATIONS)),
            join(lines.get(Section.DEFINITIONS))
        );
    }

    private boolean isContinuation(String cleaned, boolean indented, String lastDefinition) {
        return indented
            || LOWERCASE_START.matcher(cleaned).find()
            || cleaned.startsWith("-")
            || cleaned.startsWith("–")
            || cleaned.startsWith("—")
            || cleaned.startsWith("•")
            || cleaned.startsWith("(")
            || lastDefinition.endsWith(":");
    }

    private String cleanMarkdown(String text) {
        String cleaned = BOLD.matcher(text).replaceAll("$1");
        cleaned = ITALIC.matcher(cleaned).replaceAll("$1");
        cleaned = UNDERSCORE.matcher(cleaned).replaceAll("$1");
        cleaned = cleaned.replaceAll("^\\*+|\\*+$", "");
        return cleaned.strip();
    }

    private String join(List<String> lines) {
        String text = String.join("\n", lines).strip();
        return EXCESS_BLANK.matcher(text).replaceAll("\n\n");
    }
}
