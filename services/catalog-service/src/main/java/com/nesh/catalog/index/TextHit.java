package com.nesh.catalog.index;

public record TextHit(SearchEntry entry, int tier, double score, int matchedTerms) {
}
