package com.nesh.catalog.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.nesh.catalog.catalog.CatalogHolder;
import com.nesh.catalog.catalog.CatalogProperties;
import com.nesh.catalog.catalog.CatalogUnavailableException;
import com.nesh.catalog.catalog.ChapterSectionExtractor;
import com.nesh.catalog.model.Chapter;
import com.nesh.catalog.query.CodeNormalizer;
import com.nesh.catalog.query.QueryClassifier;
import com.nesh.catalog.query.QueryKind;
import com.nesh.catalog.render.ContentRenderer;
import com.nesh.catalog.render.RenderCache;
import com.nesh.catalog.service.CatalogSearchService.ChapterView;
import com.nesh.catalog.support.CatalogFixtures;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CatalogSearchServiceTest {

    private CatalogHolder holder;
    private CatalogSearchService service;

    @BeforeEach
    void setUp() {
        CatalogProperties properties = new CatalogProperties();
        ContentRenderer renderer = new ContentRenderer(new RenderCache(10));
        ChapterSectionExtractor sectionExtractor = new ChapterSectionExtractor();
        holder = new CatalogHolder();
        service = new CatalogSearchService(
            new QueryClassifier(),
            new CodeResolver(new CodeNormalizer(), renderer, sectionExtractor, properties),
            new TextSearchService(properties),
            renderer,
            sectionExtractor,
            holder
        );
    }

    @Test
    void routesCodeQueriesToResolver() {
        holder.swap(CatalogFixtures.generation());

        CatalogSearchResult result = service.search("8413.11; 8517");

        assertThat(result.kind()).isEqualTo(QueryKind.CODE);
        assertThat(result.generation()).isEqualTo(1L);
        assertThat(result.codeResults()).containsOnlyKeys("8413.11", "8517");
        assertThat(result.textResult()).isNull();
    }

    @Test
    void routesTextQueriesToIndex() {
        holder.swap(CatalogFixtures.generation());

        CatalogSearchResult result = service.search("bombas de vácuo");

        assertThat(result.kind()).isEqualTo(QueryKind.TEXT);
        assertThat(result.codeResults()).isEmpty();
        assertThat(result.textResult().hits()).isNotEmpty();
    }

    @Test
    void findsAndRendersChapter() {
        holder.swap(CatalogFixtures.generation());

        Optional<ChapterView> view = service.findChapter("84");

        assertThat(view).isPresent();
        assertThat(view.get().rendered().html()).contains("<h3 class=\"position\" id=\"pos-84-13\">");
        assertThat(view.get().generation()).isEqualTo(1L);
        assertThat(service.findChapter("99")).isEmpty();
    }

    @Test
    void listsChaptersInOrder() {
        holder.swap(CatalogFixtures.generation());

        assertThat(service.listChapters().chapters()).extracting(Chapter::getNumber).containsExactly("73", "84", "85");
    }

    @Test
    void failsWhenNoGenerationIsActive() {
        assertThatThrownBy(() -> service.search("84")).isInstanceOf(CatalogUnavailableException.class);
    }
}
