package com.nesh.catalog.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class Chapter {
    private final String number;
    private final String title;
    private final String content;
    private final String notesContent;
    private final Map<String, String> notes;
    private final List<Position> positions;

    public Chapter(
        String number,
        String title,
        String content,
        String notesContent,
        List<Note> notes,
        List<Position> positions
    ) {
        this.number = number;
        this.title = title;
        this.content = content == null ? "" : content;
        this.notesContent = notesContent;
        Map<String, String> noteMap = new LinkedHashMap<>();
        if (notes != null) {
            for (Note note : notes) {
                noteMap.putIfAbsent(note.number(), note.text());
            }
        }
        this.notes = Collections.unmodifiableMap(noteMap);
        this.positions = positions == null ? List.of() : List.copyOf(positions);
    }

    public String getNumber() {
        return number;
    }

    public String getTitle() {
        return title;
    }

    public String getContent() {
        return content;
    }

    public String getNotesContent() {
        return notesContent;
    }

    public Map<String, String> getNotes() {
        return notes;
    }

    public List<Position> getPositions() {
        return positions;
    }
}
