package com.nesh.catalog.service;

import com.nesh.catalog.catalog.ChapterSections;
import com.nesh.catalog.hierarchy.TariffNode;
import com.nesh.catalog.model.Position;
import com.nesh.catalog.query.CodeMatch;
import java.util.List;
import java.util.Map;

/**
 * Outcome for one queried code token. {@code found} tells whether the owning chapter exists;
 * {@code error} is set only when assembling the result itself failed.
 */
public record CodeResolution(
    String token,
    boolean found,
    String chapter,
    String chapterTitle,
    String targetCode,
    String matchedAnchor,
    List<Position> positions,
    Map<String, String> notes,
    String html,
    List<String> referencedNotes,
    ChapterSections sections,
    List<CodeMatch> tariffMatches,
    List<TariffNode> ancestors,
    List<TariffNode> siblings,
    String error
) {

    public static CodeResolution notFound(String token, String chapter, List<CodeMatch> tariffMatches) {
        return new CodeResolution(
            token,
            false,
            chapter,
            null,
            null,
            null,
            List.of(),
            Map.of(),
            "",
            List.of(),
            null,
            tariffMatches,
            List.of(),
            List.of(),
            null
        );
    }

    public static CodeResolution failed(String token, String chapter, String error) {
        return new CodeResolution(
            token,
            false,
            chapter,
            null,
            null,
            null,
            List.of(),
            Map.of(),
            "",
            List.of(),
            null,
            List.of(),
            List.of(),
            List.of(),
            error
        );
    }

    public TariffNode bestMatch() {
        return tariffMatches == null || tariffMatches.isEmpty() ? null : tariffMatches.get(0).node();
    }
}
