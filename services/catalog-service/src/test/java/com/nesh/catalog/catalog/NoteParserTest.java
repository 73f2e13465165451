package com.nesh.catalog.catalog;

import static org.assertj.core.api.Assertions.assertThat;

import com.nesh.catalog.model.Note;
import com.nesh.catalog.support.CatalogFixtures;
import java.util.List;
import org.junit.jupiter.api.Test;

class NoteParserTest {

    private final NoteParser parser = new NoteParser();

    @Test
    void splitsNumberedNotesAndKeepsContinuationLines() {
        List<Note> notes = parser.parse("84", CatalogFixtures.CHAPTER_84_NOTES);

        assertThat(notes).extracting(Note::number).containsExactly("1", "2", "3");
        assertThat(notes.get(1).text())
            .isEqualTo("2.- Ressalvadas as disposições da Nota 3,\nas máquinas são classificadas na posição adequada.");
        assertThat(notes.get(0).anchor()).isEqualTo("chapter-84-note-1");
    }

    @Test
    void stripsLeadingZerosAndMergesRepeatedNumbers() {
        List<Note> notes = parser.parse("01", "01. Primeira.\n2 - Segunda.\n1.- Complemento da primeira.");

        assertThat(notes).extracting(Note::number).containsExactly("1", "2");
        assertThat(notes.get(0).text()).isEqualTo("01. Primeira.\n1.- Complemento da primeira.");
    }

    @Test
    void returnsNothingForBlankContent() {
        assertThat(parser.parse("84", null)).isEmpty();
        assertThat(parser.parse("84", "  \n ")).isEmpty();
        assertThat(parser.parse("84", "Notas.\nsem numeração")).isEmpty();
    }
}
