package com.nesh.catalog.service;

import com.nesh.catalog.catalog.CatalogGeneration;
import com.nesh.catalog.catalog.CatalogProperties;
import com.nesh.catalog.catalog.ChapterSectionExtractor;
import com.nesh.catalog.catalog.ChapterSections;
import com.nesh.catalog.hierarchy.TariffNode;
import com.nesh.catalog.hierarchy.TariffTree;
import com.nesh.catalog.model.Chapter;
import com.nesh.catalog.model.Position;
import com.nesh.catalog.query.CodeFormats;
import com.nesh.catalog.query.CodeMatch;
import com.nesh.catalog.query.CodeNormalizer;
import com.nesh.catalog.query.CodeToken;
import com.nesh.catalog.render.ContentRenderer;
import com.nesh.catalog.render.RenderedChapter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class CodeResolver {
    private static final Logger logger = LoggerFactory.getLogger(CodeResolver.class);

    private final CodeNormalizer normalizer;
    private final ContentRenderer renderer;
    private final ChapterSectionExtractor sectionExtractor;
    private final CatalogProperties properties;

    public CodeResolver(
        CodeNormalizer normalizer,
        ContentRenderer renderer,
        ChapterSectionExtractor sectionExtractor,
        CatalogProperties properties
    ) {
        this.normalizer = normalizer;
        this.renderer = renderer;
        this.sectionExtractor = sectionExtractor;
        this.properties = properties;
    }

    /**
     * Resolves every token independently, keyed by the token as typed. A miss or a failure on one
     * token never affects the others.
     */
    public Map<String, CodeResolution> resolve(CatalogGeneration generation, List<CodeToken> tokens) {
        Map<String, CodeResolution> results = new LinkedHashMap<>();
        for (CodeToken token : tokens) {
            if (results.containsKey(token.raw())) {
                continue;
            }
            results.put(token.raw(), resolveToken(generation, token));
        }
        return results;
    }

    CodeResolution resolveToken(CatalogGeneration generation, CodeToken token) {
        String chapterNumber = token.chapter();
        try {
            List<CodeMatch> matches = limit(normalizer.match(generation.getTree(), token));
            Chapter chapter = generation.getChapter(chapterNumber);
            if (chapter == null) {
                logger.debug("code_chapter_not_found token={} chapter={}", token.raw(), chapterNumber);
                return CodeResolution.notFound(token.raw(), chapterNumber, matches);
            }

            Position target = targetPosition(chapter, token.digits());
            RenderedChapter rendered = renderer.render(chapter);
            ChapterSections sections = sectionExtractor.extract(chapter.getContent());
            TariffTree tree = generation.getTree();
            TariffNode best = matches.isEmpty() ? null : matches.get(0).node();

            String targetCode = null;
            if (best != null) {
                targetCode = best.getCode();
            } else if (target != null) {
                targetCode = target.code();
            }
            return new CodeResolution(
                token.raw(),
                true,
                chapter.getNumber(),
                chapter.getTitle(),
                targetCode,
                target == null ? null : target.anchor(),
                chapter.getPositions(),
                chapter.getNotes(),
                rendered.html(),
                rendered.referencedNotes(),
                sections.isEmpty() ? null : sections,
                matches,
                best == null ? List.of() : tree.ancestors(best),
                best == null ? List.of() : tree.siblings(best),
                null
            );
        } catch (RuntimeException e) {
            logger.warn("code_resolution_failed token={} chapter={}", token.raw(), chapterNumber, e);
            return CodeResolution.failed(token.raw(), chapterNumber, "failed to resolve " + token.raw());
        }
    }

    /**
     * The chapter position whose digits are the longest prefix of the queried digits.
     */
    Position targetPosition(Chapter chapter, String digits) {
        if (digits == null || digits.length() <= 2) {
            return null;
        }
        Position best = null;
        int bestLength = 0;
        for (Position position : chapter.getPositions()) {
            String positionDigits = CodeFormats.clean(position.code());
            if (positionDigits.length() > bestLength
                && positionDigits.length() <= digits.length()
                && digits.startsWith(positionDigits)) {
                best = position;
                bestLength = positionDigits.length();
            }
        }
        return best;
    }

    private List<CodeMatch> limit(List<CodeMatch> matches) {
        int max = Math.max(1, properties.getSearch().getMaxTariffMatches());
        return matches.size() > max ? List.copyOf(matches.subList(0, max)) : matches;
    }
}
