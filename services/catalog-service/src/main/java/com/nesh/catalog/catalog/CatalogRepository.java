package com.nesh.catalog.catalog;

import com.nesh.catalog.common.JdbcUtils;
import com.nesh.catalog.hierarchy.TariffNode;
import com.nesh.catalog.model.TariffLine;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class CatalogRepository {
    private final JdbcTemplate jdbcTemplate;

    public CatalogRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<ChapterRecord> findChapters() {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT chapter_num, title, content FROM chapters ORDER BY chapter_num"
        );
        List<ChapterRecord> chapters = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            String number = JdbcUtils.asChapterNumber(row.get("chapter_num"));
            if (number == null) {
                continue;
            }
            chapters.add(new ChapterRecord(
                number,
                JdbcUtils.asTrimmedString(row.get("title")),
                JdbcUtils.asString(row.get("content"))
            ));
        }
        return chapters;
    }

    public Map<String, String> findChapterNotes() {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT chapter_num, notes_content FROM chapter_notes ORDER BY chapter_num"
        );
        Map<String, String> notes = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            String number = JdbcUtils.asChapterNumber(row.get("chapter_num"));
            String content = JdbcUtils.asString(row.get("notes_content"));
            if (number != null && content != null) {
                notes.putIfAbsent(number, content);
            }
        }
        return notes;
    }

    public List<PositionRecord> findPositions() {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT chapter_num, code, description FROM positions ORDER BY chapter_num, id"
        );
        List<PositionRecord> positions = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            String chapter = JdbcUtils.asChapterNumber(row.get("chapter_num"));
            String code = JdbcUtils.asTrimmedString(row.get("code"));
            if (chapter == null || code == null) {
                continue;
            }
            positions.add(new PositionRecord(chapter, code, JdbcUtils.asTrimmedString(row.get("description"))));
        }
        return positions;
    }

    public List<TariffLine> findTariffLines() {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT code, ex_marker, description, rate FROM tariff_lines"
        );
        List<TariffLine> lines = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            lines.add(new TariffLine(
                JdbcUtils.asTrimmedString(row.get("code")),
                JdbcUtils.asTrimmedString(row.get("ex_marker")),
                JdbcUtils.asTrimmedString(row.get("description")),
                JdbcUtils.asTrimmedString(row.get("rate"))
            ));
        }
        return lines;
    }

    public int updateHierarchy(List<TariffNode> nodes, Map<String, String> parentCodes, int batchSize) {
        if (nodes == null || nodes.isEmpty()) {
            return 0;
        }
        String sql = "UPDATE tariff_lines SET level = ?, parent_code = ?, sort_key = ? "
            + "WHERE code = ? AND COALESCE(ex_marker, '') = ?";
        List<Object[]> batch = new ArrayList<>(nodes.size());
        for (TariffNode node : nodes) {
            batch.add(new Object[] {
                node.getLevel(),
                parentCodes.get(node.getKey()),
                node.getSortKey(),
                node.getSourceCode(),
                node.getSourceMarker() == null ? "" : node.getSourceMarker()
            });
        }
        int updated = 0;
        int size = Math.max(1, batchSize);
        for (int start = 0; start < batch.size(); start += size) {
            int[] counts = jdbcTemplate.batchUpdate(sql, batch.subList(start, Math.min(start + size, batch.size())));
            for (int count : counts) {
                if (count > 0) {
                    updated += count;
                }
            }
        }
        return updated;
    }

    public record ChapterRecord(String number, String title, String content) {
    }

    public record PositionRecord(String chapter, String code, String description) {
    }
}
