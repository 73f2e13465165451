package com.nesh.catalog.query;

/**
 * Display precedence of a code match, best first.
 */
public enum MatchRank {
    EXACT_FULL,
    EXACT_CLEAN,
    PREFIX
}
