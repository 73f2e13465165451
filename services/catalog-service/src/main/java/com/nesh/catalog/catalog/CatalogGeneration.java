package com.nesh.catalog.catalog;

import com.nesh.catalog.hierarchy.HierarchyBuildResult;
import com.nesh.catalog.hierarchy.TariffTree;
import com.nesh.catalog.index.TextIndex;
import com.nesh.catalog.model.Chapter;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable snapshot of everything request paths read. A rebuild produces a new generation
 * and swaps it in whole.
 */
public class CatalogGeneration {
    private final long number;
    private final Instant builtAt;
    private final Map<String, Chapter> chapters;
    private final HierarchyBuildResult hierarchy;
    private final TextIndex index;

    public CatalogGeneration(
        long number,
        Instant builtAt,
        Collection<Chapter> chapters,
        HierarchyBuildResult hierarchy,
        TextIndex index
    ) {
        this.number = number;
        this.builtAt = builtAt;
        Map<String, Chapter> byNumber = new TreeMap<>();
        for (Chapter chapter : chapters) {
            byNumber.putIfAbsent(chapter.getNumber(), chapter);
        }
        this.chapters = Collections.unmodifiableMap(byNumber);
        this.hierarchy = hierarchy == null
            ? new HierarchyBuildResult(TariffTree.empty(), List.of(), List.of(), List.of())
            : hierarchy;
        this.index = index == null ? TextIndex.empty() : index;
    }

    public CatalogGeneration withHierarchy(long nextNumber, HierarchyBuildResult nextHierarchy, TextIndex nextIndex) {
        return new CatalogGeneration(nextNumber, Instant.now(), chapters.values(), nextHierarchy, nextIndex);
    }

    public CatalogGeneration withIndex(long nextNumber, TextIndex nextIndex) {
        return new CatalogGeneration(nextNumber, Instant.now(), chapters.values(), hierarchy, nextIndex);
    }

    public long getNumber() {
        return number;
    }

    public Instant getBuiltAt() {
        return builtAt;
    }

    public Chapter getChapter(String chapterNumber) {
        return chapterNumber == null ? null : chapters.get(chapterNumber);
    }

    public Collection<Chapter> getChapters() {
        return chapters.values();
    }

    public HierarchyBuildResult getHierarchy() {
        return hierarchy;
    }

    public TariffTree getTree() {
        return hierarchy.tree();
    }

    public TextIndex getIndex() {
        return index;
    }
}
