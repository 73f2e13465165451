package com.nesh.catalog.catalog;

import com.nesh.catalog.model.Note;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Splits a chapter's notes block into numbered notes. A line starting with {@code 1.-}, {@code 2.}
 * or {@code 3 -} opens a note; text before the first numbered line is ignored.
 */
@Component
public class NoteParser {
    private static final Pattern NOTE_HEADER = Pattern.compile("^(\\d+)\\s*[.\\-–]+\\s");

    public List<Note> parse(String chapter, String notesContent) {
        if (notesContent == null || notesContent.isBlank()) {
            return List.of();
        }
        Map<String, StringBuilder> buffers = new LinkedHashMap<>();
        StringBuilder current = null;
        for (String line : notesContent.replace("\r\n", "\n").split("\n", -1)) {
            String cleaned = line.strip();
            Matcher matcher = NOTE_HEADER.matcher(cleaned);
            if (matcher.find()) {
                String number = matcher.group(1).replaceFirst("^0+(?=\\d)", "");
                current = new StringBuilder(cleaned);
                if (buffers.putIfAbsent(number, current) != null) {
                    current = buffers.get(number).append('\n').append(cleaned);
                }
                continue;
            }
            if (current != null) {
                current.append('\n').append(cleaned);
            }
        }
        List<Note> notes = new ArrayList<>(buffers.size());
        buffers.forEach((number, text) -> notes.add(new Note(chapter, number, text.toString().strip())));
        return notes;
    }
}
