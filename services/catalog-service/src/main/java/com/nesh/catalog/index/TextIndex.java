package com.nesh.catalog.index;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable inverted index over search entries. Terms match entry tokens by prefix.
 */
public class TextIndex {
    public static final int PHRASE_TIER = 1;
    public static final int ALL_TERMS_TIER = 2;
    public static final int PARTIAL_TIER = 3;

    static final double PHRASE_SCORE = 1000;
    static final double ALL_TERMS_SCORE = 500;
    static final double PARTIAL_SCORE = 100;
    static final double COVERAGE_WEIGHT = 100;

    private static final Comparator<SearchEntry> ENTRY_ORDER = Comparator.comparing(SearchEntry::sortKey)
        .thenComparing(SearchEntry::type)
        .thenComparing(SearchEntry::id);
    private static final Comparator<TextHit> HIT_ORDER = Comparator
        .comparingDouble(TextHit::score).reversed()
        .thenComparing(hit -> hit.entry().sortKey())
        .thenComparing(hit -> hit.entry().type())
        .thenComparing(hit -> hit.entry().id());

    private final List<SearchEntry> entries;
    private final NavigableMap<String, BitSet> postings;

    public TextIndex(List<SearchEntry> entries) {
        List<SearchEntry> sorted = new ArrayList<>(entries);
        sorted.sort(ENTRY_ORDER);
        this.entries = List.copyOf(sorted);
        NavigableMap<String, BitSet> tokenMap = new TreeMap<>();
        for (int i = 0; i < this.entries.size(); i++) {
            for (String token : TextNormalizer.tokens(this.entries.get(i).normalized())) {
                tokenMap.computeIfAbsent(token, key -> new BitSet()).set(i);
            }
        }
        this.postings = tokenMap;
    }

    public static TextIndex empty() {
        return new TextIndex(List.of());
    }

    public int size() {
        return entries.size();
    }

    public List<SearchEntry> entries() {
        return entries;
    }

    public int tokenCount() {
        return postings.size();
    }

    /**
     * Ranks entries by tier (phrase, all terms, partial) plus term coverage, best first.
     */
    public List<TextHit> search(String normalizedPhrase, List<String> terms, int limit) {
        if (terms == null || terms.isEmpty() || limit <= 0) {
            return List.of();
        }
        List<BitSet> termMatches = new ArrayList<>(terms.size());
        BitSet candidates = new BitSet(entries.size());
        for (String term : terms) {
            BitSet matches = prefixMatches(term);
            termMatches.add(matches);
            candidates.or(matches);
        }
        List<TextHit> hits = new ArrayList<>();
        for (int i = candidates.nextSetBit(0); i >= 0; i = candidates.nextSetBit(i + 1)) {
            int matched = 0;
            for (BitSet matches : termMatches) {
                if (matches.get(i)) {
                    matched++;
                }
            }
            SearchEntry entry = entries.get(i);
            double coverage = (double) matched / terms.size();
            int tier;
            double base;
            if (containsPhrase(entry.normalized(), normalizedPhrase)) {
                tier = PHRASE_TIER;
                base = PHRASE_SCORE;
            } else if (matched == terms.size()) {
                tier = ALL_TERMS_TIER;
                base = ALL_TERMS_SCORE;
            } else {
                tier = PARTIAL_TIER;
                base = PARTIAL_SCORE;
            }
            hits.add(new TextHit(entry, tier, base + coverage * COVERAGE_WEIGHT, matched));
        }
        hits.sort(HIT_ORDER);
        return hits.size() > limit ? List.copyOf(hits.subList(0, limit)) : hits;
    }

    /**
     * Stable fingerprint of the indexed content; equal for indexes built from identical input.
     */
    public Set<String> fingerprint() {
        Set<String> keys = new HashSet<>(entries.size());
        for (SearchEntry entry : entries) {
            keys.add(entry.type() + ":" + entry.id() + ":" + entry.normalized());
        }
        return keys;
    }

    private BitSet prefixMatches(String term) {
        BitSet matches = new BitSet(entries.size());
        for (BitSet bits : postings.subMap(term, true, term + Character.MAX_VALUE, false).values()) {
            matches.or(bits);
        }
        return matches;
    }

    private boolean containsPhrase(String normalized, String phrase) {
        if (phrase == null || phrase.isEmpty()) {
            return false;
        }
        return (" " + normalized + " ").contains(" " + phrase + " ");
    }
}
