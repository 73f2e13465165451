package com.nesh.catalog.service;

import com.nesh.catalog.catalog.CatalogGeneration;
import com.nesh.catalog.catalog.CatalogHolder;
import com.nesh.catalog.catalog.ChapterSectionExtractor;
import com.nesh.catalog.catalog.ChapterSections;
import com.nesh.catalog.model.Chapter;
import com.nesh.catalog.query.ClassifiedQuery;
import com.nesh.catalog.query.QueryClassifier;
import com.nesh.catalog.render.ContentRenderer;
import com.nesh.catalog.render.RenderedChapter;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class CatalogSearchService {
    private static final Logger logger = LoggerFactory.getLogger(CatalogSearchService.class);

    private final QueryClassifier classifier;
    private final CodeResolver codeResolver;
    private final TextSearchService textSearchService;
    private final ContentRenderer renderer;
    private final ChapterSectionExtractor sectionExtractor;
    private final CatalogHolder catalogHolder;

    public CatalogSearchService(
        QueryClassifier classifier,
        CodeResolver codeResolver,
        TextSearchService textSearchService,
        ContentRenderer renderer,
        ChapterSectionExtractor sectionExtractor,
        CatalogHolder catalogHolder
    ) {
        this.classifier = classifier;
        this.codeResolver = codeResolver;
        this.textSearchService = textSearchService;
        this.renderer = renderer;
        this.sectionExtractor = sectionExtractor;
        this.catalogHolder = catalogHolder;
    }

    public CatalogSearchResult search(String query) {
        CatalogGeneration generation = catalogHolder.current();
        ClassifiedQuery classified = classifier.classify(query);
        if (classified.isCode()) {
            Map<String, CodeResolution> results = codeResolver.resolve(generation, classified.tokens());
            logger.debug("code_search query={} tokens={} generation={}", classified.text(), results.size(), generation.getNumber());
            return CatalogSearchResult.code(classified.text(), generation.getNumber(), results);
        }
        TextSearchResult result = textSearchService.search(generation, classified.text());
        return CatalogSearchResult.text(classified.text(), generation.getNumber(), result);
    }

    public ChapterListing listChapters() {
        CatalogGeneration generation = catalogHolder.current();
        return new ChapterListing(generation.getNumber(), List.copyOf(generation.getChapters()));
    }

    public Optional<ChapterView> findChapter(String chapterNumber) {
        CatalogGeneration generation = catalogHolder.current();
        Chapter chapter = generation.getChapter(chapterNumber);
        if (chapter == null) {
            return Optional.empty();
        }
        return Optional.of(new ChapterView(
            chapter,
            renderer.render(chapter),
            sectionExtractor.extract(chapter.getContent()),
            generation.getNumber()
        ));
    }

    public record ChapterListing(long generation, List<Chapter> chapters) {
    }

    public record ChapterView(Chapter chapter, RenderedChapter rendered, ChapterSections sections, long generation) {
    }
}
