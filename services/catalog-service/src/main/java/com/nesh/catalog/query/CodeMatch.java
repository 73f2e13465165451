package com.nesh.catalog.query;

import com.nesh.catalog.hierarchy.TariffNode;

public record CodeMatch(TariffNode node, MatchRank rank, CandidateKind matchedBy) {
}
