package com.nesh.catalog.catalog;

import com.nesh.catalog.catalog.CatalogRepository.ChapterRecord;
import com.nesh.catalog.catalog.CatalogRepository.PositionRecord;
import com.nesh.catalog.model.Chapter;
import com.nesh.catalog.model.Note;
import com.nesh.catalog.model.Position;
import com.nesh.catalog.model.TariffLine;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Reads ingested catalog tables and assembles chapters with parsed notes and anchored positions.
 */
@Component
public class CatalogLoader {
    private static final Logger logger = LoggerFactory.getLogger(CatalogLoader.class);

    private final CatalogRepository repository;
    private final NoteParser noteParser;
    private final ChapterSectionExtractor sectionExtractor;

    public CatalogLoader(
        CatalogRepository repository,
        NoteParser noteParser,
        ChapterSectionExtractor sectionExtractor
    ) {
        this.repository = repository;
        this.noteParser = noteParser;
        this.sectionExtractor = sectionExtractor;
    }

    public List<Chapter> loadChapters() {
        List<ChapterRecord> records;
        Map<String, String> notesByChapter;
        List<PositionRecord> positionRecords;
        try {
            records = repository.findChapters();
            notesByChapter = repository.findChapterNotes();
            positionRecords = repository.findPositions();
        } catch (DataAccessException e) {
            throw new CatalogLoadException("failed to read chapters", e);
        }

        Map<String, List<PositionRecord>> positionsByChapter = new LinkedHashMap<>();
        for (PositionRecord record : positionRecords) {
            positionsByChapter.computeIfAbsent(record.chapter(), key -> new ArrayList<>()).add(record);
        }

        List<Chapter> chapters = new ArrayList<>(records.size());
        for (ChapterRecord record : records) {
            String notesContent = notesByChapter.get(record.number());
            List<Note> notes = noteParser.parse(record.number(), notesContent);
            List<Position> positions = toPositions(record.number(), positionsByChapter.get(record.number()));
            chapters.add(new Chapter(
                record.number(),
                resolveTitle(record),
                record.content(),
                notesContent,
                notes,
                positions
            ));
        }
        logger.info("catalog_chapters_loaded chapters={} positions={}", chapters.size(), positionRecords.size());
        return chapters;
    }

    public List<TariffLine> loadTariffLines() {
        try {
            List<TariffLine> lines = repository.findTariffLines();
            logger.info("catalog_tariff_lines_loaded rows={}", lines.size());
            return lines;
        } catch (DataAccessException e) {
            throw new CatalogLoadException("failed to read tariff lines", e);
        }
    }

    private String resolveTitle(ChapterRecord record) {
        if (record.title() != null && !record.title().isBlank()) {
            return record.title();
        }
        String title = sectionExtractor.extract(record.content()).title();
        return title.isBlank() ? null : title;
    }

    private List<Position> toPositions(String chapter, List<PositionRecord> records) {
        if (records == null) {
            return List.of();
        }
        List<Position> positions = new ArrayList<>(records.size());
        Set<String> anchors = new HashSet<>();
        for (PositionRecord record : records) {
            Position position = Position.of(chapter, record.code(), record.description());
            if (position.anchor() == null) {
                logger.warn("catalog_position_skipped chapter={} code={} reason=invalid_code", chapter, record.code());
                continue;
            }
            if (!anchors.add(position.anchor())) {
                logger.warn("catalog_position_skipped chapter={} code={} reason=duplicate_anchor", chapter, record.code());
                continue;
            }
            positions.add(position);
        }
        return positions;
    }
}
