package com.nesh.catalog.index;

import com.nesh.catalog.hierarchy.SortKeys;
import com.nesh.catalog.hierarchy.TariffNode;
import com.nesh.catalog.hierarchy.TariffTree;
import com.nesh.catalog.model.Chapter;
import com.nesh.catalog.model.Position;
import com.nesh.catalog.query.CodeFormats;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class TextIndexBuilder {
    private static final Logger logger = LoggerFactory.getLogger(TextIndexBuilder.class);

    public TextIndex build(Collection<Chapter> chapters, TariffTree tree) {
        List<SearchEntry> entries = new ArrayList<>();
        for (Chapter chapter : chapters) {
            entries.add(chapterEntry(chapter));
            for (Position position : chapter.getPositions()) {
                entries.add(positionEntry(chapter, position));
            }
        }
        if (tree != null) {
            for (TariffNode node : tree.ordered()) {
                entries.add(tariffEntry(node));
            }
        }
        TextIndex index = new TextIndex(entries);
        logger.info("text_index_built entries={} tokens={}", index.size(), index.tokenCount());
        return index;
    }

    private SearchEntry chapterEntry(Chapter chapter) {
        String title = chapter.getTitle() == null ? "" : chapter.getTitle();
        String text = title;
        if (chapter.getNotesContent() != null && !chapter.getNotesContent().isBlank()) {
            text = title + "\n" + chapter.getNotesContent().strip();
        }
        return new SearchEntry(
            EntryType.CHAPTER,
            chapter.getNumber(),
            chapter.getNumber(),
            title,
            text,
            TextNormalizer.normalize(text),
            SortKeys.of(chapter.getNumber())
        );
    }

    private SearchEntry positionEntry(Chapter chapter, Position position) {
        String description = position.description() == null ? "" : position.description();
        String digits = CodeFormats.clean(position.code());
        String sortKey = digits.isEmpty() || digits.length() > CodeFormats.MAX_DIGITS
            ? SortKeys.of(chapter.getNumber())
            : SortKeys.of(digits);
        return new SearchEntry(
            EntryType.POSITION,
            position.code(),
            chapter.getNumber(),
            position.code(),
            description,
            TextNormalizer.normalize(position.code() + " " + description),
            sortKey
        );
    }

    private SearchEntry tariffEntry(TariffNode node) {
        String description = node.getDescription() == null ? "" : node.getDescription();
        return new SearchEntry(
            EntryType.TARIFF_LINE,
            node.getKey(),
            node.getChapter(),
            node.getCode(),
            description,
            TextNormalizer.normalize(description),
            node.getSortKey()
        );
    }
}
