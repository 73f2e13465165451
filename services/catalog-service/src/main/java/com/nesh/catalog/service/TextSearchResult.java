package com.nesh.catalog.service;

import java.util.List;

public record TextSearchResult(
    String query,
    String normalized,
    String matchType,
    String warning,
    List<TextSearchHit> hits
) {

    public static final String MATCH_EXACT = "exact";
    public static final String MATCH_ALL_WORDS = "all_words";
    public static final String MATCH_PARTIAL = "partial";
    public static final String MATCH_NONE = "none";

    public static TextSearchResult empty(String query, String normalized) {
        return new TextSearchResult(query, normalized, MATCH_NONE, null, List.of());
    }
}
