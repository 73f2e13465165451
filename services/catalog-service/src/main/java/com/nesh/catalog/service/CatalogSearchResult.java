package com.nesh.catalog.service;

import com.nesh.catalog.query.QueryKind;
import java.util.Map;

/**
 * Either per-token code results or a ranked text result, depending on how the query classified.
 */
public record CatalogSearchResult(
    QueryKind kind,
    String query,
    long generation,
    Map<String, CodeResolution> codeResults,
    TextSearchResult textResult
) {

    public static CatalogSearchResult code(String query, long generation, Map<String, CodeResolution> results) {
        return new CatalogSearchResult(QueryKind.CODE, query, generation, results, null);
    }

    public static CatalogSearchResult text(String query, long generation, TextSearchResult result) {
        return new CatalogSearchResult(QueryKind.TEXT, query, generation, Map.of(), result);
    }
}
