package com.nesh.catalog.service;

import com.nesh.catalog.catalog.CatalogGeneration;
import com.nesh.catalog.catalog.CatalogProperties;
import com.nesh.catalog.index.EntryType;
import com.nesh.catalog.index.SearchEntry;
import com.nesh.catalog.index.TextHit;
import com.nesh.catalog.index.TextIndex;
import com.nesh.catalog.index.TextNormalizer;
import com.nesh.catalog.model.AnchorIds;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class TextSearchService {
    private static final Logger logger = LoggerFactory.getLogger(TextSearchService.class);

    private final CatalogProperties properties;

    public TextSearchService(CatalogProperties properties) {
        this.properties = properties;
    }

    public TextSearchResult search(CatalogGeneration generation, String query) {
        String raw = query == null ? "" : query.trim();
        String normalized = TextNormalizer.normalize(raw);
        if (normalized.isEmpty()) {
            return TextSearchResult.empty(raw, normalized);
        }
        Set<String> stopwords = new HashSet<>();
        for (String stopword : properties.getSearch().getStopwords()) {
            stopwords.add(TextNormalizer.normalize(stopword));
        }
        List<String> terms = TextNormalizer.terms(normalized, stopwords);
        TextIndex index = generation.getIndex();
        List<TextHit> hits = index.search(normalized, terms, properties.getSearch().getMaxResults());
        if (hits.isEmpty()) {
            logger.debug("text_search_empty query={} terms={}", normalized, terms.size());
            return TextSearchResult.empty(raw, normalized);
        }

        List<TextSearchHit> results = new ArrayList<>(hits.size());
        int rank = 1;
        for (TextHit hit : hits) {
            SearchEntry entry = hit.entry();
            results.add(new TextSearchHit(
                entry.type(),
                entry.id(),
                entry.chapter(),
                entry.title(),
                snippet(entry.text(), terms),
                anchorOf(entry),
                hit.tier(),
                hit.score(),
                rank++
            ));
        }

        int bestTier = hits.get(0).tier();
        for (TextHit hit : hits) {
            bestTier = Math.min(bestTier, hit.tier());
        }
        String matchType;
        String warning = null;
        if (bestTier == TextIndex.PHRASE_TIER) {
            matchType = TextSearchResult.MATCH_EXACT;
        } else if (bestTier == TextIndex.ALL_TERMS_TIER) {
            matchType = TextSearchResult.MATCH_ALL_WORDS;
        } else {
            matchType = TextSearchResult.MATCH_PARTIAL;
            warning = "No exact match for \"" + raw + "\"; showing partial matches for: " + String.join(", ", terms);
        }
        logger.debug("text_search query={} hits={} match_type={}", normalized, results.size(), matchType);
        return new TextSearchResult(raw, normalized, matchType, warning, results);
    }

    /**
     * Window of the display text around the first token that starts with a query term.
     */
    String snippet(String text, List<String> terms) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String flat = text.replaceAll("\\s+", " ").trim();
        int length = Math.max(20, properties.getSearch().getSnippetLength());
        if (flat.length() <= length) {
            return flat;
        }
        int hitAt = firstHit(flat, terms);
        int start = Math.max(0, hitAt - length / 4);
        int end = Math.min(flat.length(), start + length);
        start = Math.max(0, end - length);
        String window = flat.substring(start, end).trim();
        return (start > 0 ? "..." : "") + window + (end < flat.length() ? "..." : "");
    }

    private int firstHit(String flat, List<String> terms) {
        String[] words = flat.split(" ");
        int offset = 0;
        for (String word : words) {
            String normalizedWord = TextNormalizer.normalize(word);
            for (String term : terms) {
                if (normalizedWord.startsWith(term)) {
                    return offset;
                }
            }
            offset += word.length() + 1;
        }
        return 0;
    }

    private String anchorOf(SearchEntry entry) {
        if (entry.type() == EntryType.CHAPTER) {
            return null;
        }
        return AnchorIds.forCode(entry.title());
    }
}
