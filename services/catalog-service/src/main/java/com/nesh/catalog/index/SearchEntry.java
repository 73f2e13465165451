package com.nesh.catalog.index;

/**
 * Searchable form of a chapter, position or tariff line. {@code text} is what hits display,
 * {@code normalized} is what queries match against.
 */
public record SearchEntry(
    EntryType type,
    String id,
    String chapter,
    String title,
    String text,
    String normalized,
    String sortKey
) {
}
