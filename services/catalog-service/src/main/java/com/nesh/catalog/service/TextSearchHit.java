package com.nesh.catalog.service;

import com.nesh.catalog.index.EntryType;

public record TextSearchHit(
    EntryType type,
    String id,
    String chapter,
    String title,
    String snippet,
    String anchor,
    int tier,
    double score,
    int rank
) {
}
