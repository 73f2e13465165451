package com.nesh.catalog.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.nesh.catalog.catalog.CatalogRepository.ChapterRecord;
import com.nesh.catalog.catalog.CatalogRepository.PositionRecord;
import com.nesh.catalog.model.Chapter;
import com.nesh.catalog.model.Position;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class CatalogLoaderTest {

    @Mock
    private CatalogRepository repository;

    private CatalogLoader loader;

    @BeforeEach
    void setUp() {
        loader = new CatalogLoader(repository, new NoteParser(), new ChapterSectionExtractor());
    }

    @Test
    void assemblesChaptersWithNotesAndPositions() {
        when(repository.findChapters()).thenReturn(List.of(
            new ChapterRecord("84", "Máquinas", "84.13 - Bombas"),
            new ChapterRecord("85", null, "Capítulo 85\nMáquinas elétricas\n85.17 - Telefones")
        ));
        when(repository.findChapterNotes()).thenReturn(Map.of("84", "Notas.\n1.- Primeira.\n2.- Segunda."));
        when(repository.findPositions()).thenReturn(List.of(
            new PositionRecord("84", "84.13", "Bombas"),
            new PositionRecord("84", "84-13", "Duplicada"),
            new PositionRecord("84", "...", "Sem dígitos"),
            new PositionRecord("85", "85.17", "Telefones")
        ));

        List<Chapter> chapters = loader.loadChapters();

        assertThat(chapters).extracting(Chapter::getNumber).containsExactly("84", "85");
        Chapter chapter84 = chapters.get(0);
        assertThat(chapter84.getNotes()).containsOnlyKeys("1", "2");
        assertThat(chapter84.getPositions()).extracting(Position::anchor).containsExactly("pos-84-13");
        assertThat(chapters.get(1).getTitle()).isEqualTo("Máquinas elétricas");
        assertThat(chapters.get(1).getNotes()).isEmpty();
    }

    @Test
    void wrapsDataAccessFailures() {
        when(repository.findChapters()).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatThrownBy(() -> loader.loadChapters())
            .isInstanceOf(CatalogLoadException.class)
            .hasMessageContaining("chapters");
    }
}
