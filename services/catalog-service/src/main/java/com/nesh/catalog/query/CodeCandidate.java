package com.nesh.catalog.query;

public record CodeCandidate(CandidateKind kind, String value) {

    public boolean matchesDigits() {
        return kind == CandidateKind.CLEAN;
    }
}
