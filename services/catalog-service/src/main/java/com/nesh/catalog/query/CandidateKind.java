package com.nesh.catalog.query;

public enum CandidateKind {
    RAW,
    CLEAN,
    DOTTED,
    TARIFF
}
