package com.nesh.catalog.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.nesh.catalog.catalog.CatalogGeneration;
import com.nesh.catalog.catalog.CatalogProperties;
import com.nesh.catalog.index.EntryType;
import com.nesh.catalog.support.CatalogFixtures;
import java.util.List;
import org.junit.jupiter.api.Test;

class TextSearchServiceTest {

    private final CatalogProperties properties = new CatalogProperties();
    private final TextSearchService service = new TextSearchService(properties);
    private final CatalogGeneration generation = CatalogFixtures.generation();

    @Test
    void exactPhraseRanksFirst() {
        TextSearchResult result = service.search(generation, "Bombas de VÁCUO");

        assertThat(result.normalized()).isEqualTo("bombas de vacuo");
        assertThat(result.matchType()).isEqualTo(TextSearchResult.MATCH_EXACT);
        assertThat(result.warning()).isNull();
        TextSearchHit first = result.hits().get(0);
        assertThat(first.id()).isEqualTo("84141000");
        assertThat(first.type()).isEqualTo(EntryType.TARIFF_LINE);
        assertThat(first.rank()).isEqualTo(1);
        assertThat(first.anchor()).isEqualTo("pos-8414-10-00");
        assertThat(result.hits()).extracting(TextSearchHit::id).contains("84.14");
    }

    @Test
    void partialMatchesCarryWarning() {
        TextSearchResult result = service.search(generation, "smartphones inexistente");

        assertThat(result.matchType()).isEqualTo(TextSearchResult.MATCH_PARTIAL);
        assertThat(result.warning()).contains("smartphones inexistente").contains("smartphones, inexistente");
        assertThat(result.hits()).extracting(TextSearchHit::chapter).containsOnly("85");
    }

    @Test
    void chapterHitsHaveNoAnchor() {
        TextSearchResult result = service.search(generation, "reatores");

        TextSearchHit first = result.hits().get(0);
        assertThat(first.type()).isEqualTo(EntryType.CHAPTER);
        assertThat(first.id()).isEqualTo("84");
        assertThat(first.anchor()).isNull();
    }

    @Test
    void blankOrUnknownQueryReturnsNoHits() {
        assertThat(service.search(generation, "  ").matchType()).isEqualTo(TextSearchResult.MATCH_NONE);
        assertThat(service.search(generation, "???").hits()).isEmpty();
        assertThat(service.search(generation, "zzzz").hits()).isEmpty();
    }

    @Test
    void respectsMaxResults() {
        properties.getSearch().setMaxResults(2);

        assertThat(service.search(generation, "bombas").hits()).hasSize(2);
    }

    @Test
    void snippetCentersOnFirstMatchingWord() {
        properties.getSearch().setSnippetLength(20);

        String snippet = service.snippet("aaaa bbbb cccc dddd eeee ffff gggg hhhh iiii", List.of("gggg"));

        assertThat(snippet).isEqualTo("...ffff gggg hhhh iiii");
        assertThat(service.snippet("curto", List.of("curto"))).isEqualTo("curto");
    }
}
