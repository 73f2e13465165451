package com.nesh.catalog.catalog;

public record ChapterSections(String title, String notes, String considerations, String definitions) {

    public static ChapterSections empty() {
        return new ChapterSections("", "", "", "");
    }

    public boolean isEmpty() {
        return title.isBlank() && notes.isBlank() && considerations.isBlank() && definitions.isBlank();
    }
}
