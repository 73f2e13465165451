package com.nesh.catalog.query;

import com.nesh.catalog.hierarchy.HierarchyBuilder;
import com.nesh.catalog.hierarchy.TariffNode;
import com.nesh.catalog.hierarchy.TariffTree;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class CodeNormalizer {
    private static final Comparator<CodeMatch> DISPLAY_ORDER = Comparator
        .comparing((CodeMatch match) -> match.rank())
        .thenComparing(match -> match.node().getSortKey())
        .thenComparing(match -> match.node().getKey());

    /**
     * Representations the catalog may use for the token, in precedence order.
     */
    public List<CodeCandidate> candidates(CodeToken token) {
        String raw = token.code() == null ? "" : token.code().trim();
        String digits = CodeFormats.clean(raw);
        List<CodeCandidate> candidates = new ArrayList<>(4);
        addCandidate(candidates, CandidateKind.RAW, raw);
        addCandidate(candidates, CandidateKind.CLEAN, digits);
        addCandidate(candidates, CandidateKind.DOTTED, CodeFormats.dotted(digits));
        addCandidate(candidates, CandidateKind.TARIFF, CodeFormats.tariff(digits));
        return candidates;
    }

    /**
     * Prefix-matches every candidate against the tree and returns one match per node, best rank kept.
     */
    public List<CodeMatch> match(TariffTree tree, CodeToken token) {
        if (tree == null || token == null) {
            return List.of();
        }
        if (token.isException()) {
            TariffNode node = tree.get(HierarchyBuilder.keyOf(token.digits(), token.exceptionIndex()));
            if (node == null) {
                return List.of();
            }
            return List.of(new CodeMatch(node, MatchRank.EXACT_FULL, CandidateKind.CLEAN));
        }
        String digits = token.digits();
        Map<String, CodeMatch> byKey = new LinkedHashMap<>();
        for (CodeCandidate candidate : candidates(token)) {
            List<TariffNode> nodes = candidate.matchesDigits()
                ? tree.findByDigitsPrefix(candidate.value())
                : tree.findByCodePrefix(candidate.value());
            for (TariffNode node : nodes) {
                CodeMatch match = new CodeMatch(node, rankOf(node, candidate, digits), candidate.kind());
                byKey.merge(node.getKey(), match, (left, right) -> right.rank().compareTo(left.rank()) < 0 ? right : left);
            }
        }
        List<CodeMatch> matches = new ArrayList<>(byKey.values());
        matches.sort(DISPLAY_ORDER);
        return matches;
    }

    private MatchRank rankOf(TariffNode node, CodeCandidate candidate, String digits) {
        if (!candidate.matchesDigits() && node.getCode().equals(candidate.value())) {
            return MatchRank.EXACT_FULL;
        }
        if (!node.isException() && node.getDigits().equals(digits)) {
            return MatchRank.EXACT_CLEAN;
        }
        return MatchRank.PREFIX;
    }

    private void addCandidate(List<CodeCandidate> candidates, CandidateKind kind, String value) {
        if (value == null || value.isEmpty()) {
            return;
        }
        for (CodeCandidate existing : candidates) {
            if (existing.value().equals(value) && existing.matchesDigits() == (kind == CandidateKind.CLEAN)) {
                return;
            }
        }
        candidates.add(new CodeCandidate(kind, value));
    }
}
