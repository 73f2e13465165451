package com.nesh.catalog.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.nesh.catalog.catalog.CatalogRepository.ChapterRecord;
import com.nesh.catalog.catalog.CatalogRepository.PositionRecord;
import com.nesh.catalog.hierarchy.TariffNode;
import com.nesh.catalog.model.TariffLine;
import com.nesh.catalog.support.CatalogFixtures;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

@ExtendWith(MockitoExtension.class)
class CatalogRepositoryTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Test
    void findChaptersPadsNumbersAndSkipsInvalidRows() {
        when(jdbcTemplate.queryForList(anyString())).thenReturn(List.of(
            row("chapter_num", 1, "title", " Animais vivos ", "content", "texto"),
            row("chapter_num", "84", "title", "", "content", null),
            row("chapter_num", "abc", "title", "x", "content", "y")
        ));

        List<ChapterRecord> chapters = new CatalogRepository(jdbcTemplate).findChapters();

        assertThat(chapters).containsExactly(
            new ChapterRecord("01", "Animais vivos", "texto"),
            new ChapterRecord("84", null, null)
        );
        ArgumentCaptor<String> sqlCaptor = ArgumentCaptor.forClass(String.class);
        verify(jdbcTemplate).queryForList(sqlCaptor.capture());
        assertThat(sqlCaptor.getValue()).contains("FROM chapters").contains("ORDER BY chapter_num");
    }

    @Test
    void findPositionsSkipsRowsWithoutCode() {
        when(jdbcTemplate.queryForList(anyString())).thenReturn(List.of(
            row("chapter_num", "84", "code", "84.13", "description", "Bombas"),
            row("chapter_num", "84", "code", " ", "description", "sem código")
        ));

        List<PositionRecord> positions = new CatalogRepository(jdbcTemplate).findPositions();

        assertThat(positions).containsExactly(new PositionRecord("84", "84.13", "Bombas"));
    }

    @Test
    void findTariffLinesTrimsColumns() {
        when(jdbcTemplate.queryForList(anyString())).thenReturn(List.of(
            row("code", " 8413.11.00 ", "ex_marker", "01", "description", "Ex 01 - Aeronaves", "rate", 5)
        ));

        List<TariffLine> lines = new CatalogRepository(jdbcTemplate).findTariffLines();

        assertThat(lines).containsExactly(new TariffLine("8413.11.00", "01", "Ex 01 - Aeronaves", "5"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void updateHierarchyWritesInBatches() {
        when(jdbcTemplate.batchUpdate(anyString(), anyList())).thenReturn(new int[] {1, 1}, new int[] {1});
        List<TariffNode> nodes = CatalogFixtures.hierarchy().tree().ordered().subList(0, 3);
        Map<String, String> parents = new HashMap<>();
        parents.put(nodes.get(1).getKey(), nodes.get(0).getCode());

        int updated = new CatalogRepository(jdbcTemplate).updateHierarchy(nodes, parents, 2);

        assertThat(updated).isEqualTo(3);
        ArgumentCaptor<List<Object[]>> batchCaptor = ArgumentCaptor.forClass(List.class);
        verify(jdbcTemplate, times(2)).batchUpdate(
            eq("UPDATE tariff_lines SET level = ?, parent_code = ?, sort_key = ? "
                + "WHERE code = ? AND COALESCE(ex_marker, '') = ?"),
            batchCaptor.capture()
        );
        List<Object[]> first = batchCaptor.getAllValues().get(0);
        assertThat(first).hasSize(2);
        assertThat(first.get(1)[1]).isEqualTo(nodes.get(0).getCode());
        assertThat(first.get(1)[3]).isEqualTo(nodes.get(1).getSourceCode());
    }

    @Test
    void updateHierarchyIgnoresEmptyInput() {
        assertThat(new CatalogRepository(jdbcTemplate).updateHierarchy(List.of(), Map.of(), 10)).isZero();
    }

    private Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }
}
