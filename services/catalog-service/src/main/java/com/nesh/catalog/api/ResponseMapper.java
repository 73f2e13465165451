package com.nesh.catalog.api;

import com.nesh.catalog.api.dto.ChapterResponse;
import com.nesh.catalog.api.dto.ChapterSummaryDto;
import com.nesh.catalog.api.dto.CodeResultDto;
import com.nesh.catalog.api.dto.PositionDto;
import com.nesh.catalog.api.dto.RebuildResponse;
import com.nesh.catalog.api.dto.SearchResponse;
import com.nesh.catalog.api.dto.SectionsDto;
import com.nesh.catalog.api.dto.StatusResponse;
import com.nesh.catalog.api.dto.TariffNodeDto;
import com.nesh.catalog.api.dto.TextHitDto;
import com.nesh.catalog.catalog.CatalogGeneration;
import com.nesh.catalog.catalog.ChapterSections;
import com.nesh.catalog.hierarchy.HierarchyBuildResult;
import com.nesh.catalog.hierarchy.TariffNode;
import com.nesh.catalog.model.AnchorIds;
import com.nesh.catalog.model.Chapter;
import com.nesh.catalog.model.Position;
import com.nesh.catalog.query.CodeMatch;
import com.nesh.catalog.service.CatalogSearchResult;
import com.nesh.catalog.service.CatalogSearchService.ChapterView;
import com.nesh.catalog.service.CodeResolution;
import com.nesh.catalog.service.RebuildOutcome;
import com.nesh.catalog.service.TextSearchHit;
import com.nesh.catalog.service.TextSearchResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

final class ResponseMapper {
    private ResponseMapper() {
    }

    static SearchResponse toSearchResponse(CatalogSearchResult result, String traceId, String requestId) {
        SearchResponse response = new SearchResponse();
        response.setQuery(result.query());
        response.setGeneration(result.generation());
        response.setTraceId(traceId);
        response.setRequestId(requestId);
        if (result.textResult() == null) {
            response.setType("code");
            Map<String, CodeResultDto> results = new LinkedHashMap<>();
            result.codeResults().forEach((token, resolution) -> results.put(token, toCodeResult(resolution)));
            response.setResults(results);
            response.setTotal(results.size());
            return response;
        }
        TextSearchResult text = result.textResult();
        response.setType("text");
        response.setNormalized(text.normalized());
        response.setMatchType(text.matchType());
        response.setWarning(text.warning());
        List<TextHitDto> hits = new ArrayList<>(text.hits().size());
        for (TextSearchHit hit : text.hits()) {
            hits.add(toTextHit(hit));
        }
        response.setHits(hits);
        response.setTotal(hits.size());
        return response;
    }

    static CodeResultDto toCodeResult(CodeResolution resolution) {
        CodeResultDto dto = new CodeResultDto();
        dto.setToken(resolution.token());
        dto.setFound(resolution.found());
        dto.setChapter(resolution.chapter());
        dto.setChapterTitle(resolution.chapterTitle());
        dto.setTargetCode(resolution.targetCode());
        dto.setMatchedAnchor(resolution.matchedAnchor());
        dto.setPositions(toPositions(resolution.positions()));
        dto.setNotes(resolution.notes());
        dto.setHtml(resolution.html());
        dto.setReferencedNotes(resolution.referencedNotes());
        dto.setSections(toSections(resolution.sections()));
        List<TariffNodeDto> matches = new ArrayList<>(resolution.tariffMatches().size());
        for (CodeMatch match : resolution.tariffMatches()) {
            TariffNodeDto node = toNode(match.node());
            node.setMatchRank(match.rank().name().toLowerCase(Locale.ROOT));
            matches.add(node);
        }
        dto.setTariffMatches(matches);
        dto.setAncestors(toNodes(resolution.ancestors()));
        dto.setSiblings(toNodes(resolution.siblings()));
        dto.setError(resolution.error());
        return dto;
    }

    static ChapterResponse toChapterResponse(ChapterView view, String traceId, String requestId) {
        Chapter chapter = view.chapter();
        ChapterResponse response = new ChapterResponse();
        response.setChapter(chapter.getNumber());
        response.setTitle(chapter.getTitle());
        response.setHtml(view.rendered().html());
        response.setNotes(chapter.getNotes());
        response.setReferencedNotes(view.rendered().referencedNotes());
        response.setPositions(toPositions(chapter.getPositions()));
        response.setSections(toSections(view.sections()));
        response.setGeneration(view.generation());
        response.setTraceId(traceId);
        response.setRequestId(requestId);
        return response;
    }

    static ChapterSummaryDto toChapterSummary(Chapter chapter) {
        ChapterSummaryDto dto = new ChapterSummaryDto();
        dto.setChapter(chapter.getNumber());
        dto.setTitle(chapter.getTitle());
        dto.setPositionCount(chapter.getPositions().size());
        return dto;
    }

    static RebuildResponse toRebuildResponse(RebuildOutcome outcome, String traceId, String requestId) {
        RebuildResponse response = new RebuildResponse();
        response.setOperation(outcome.operation());
        response.setStatus(outcome.status().name().toLowerCase(Locale.ROOT));
        response.setGeneration(outcome.generation());
        response.setChapters(outcome.chapters());
        response.setTariffNodes(outcome.tariffNodes());
        response.setIndexEntries(outcome.indexEntries());
        response.setOrphans(outcome.orphans());
        response.setSkippedRows(outcome.skippedRows());
        response.setDuplicates(outcome.duplicates());
        response.setTookMs(outcome.tookMs());
        response.setMessage(outcome.message());
        response.setTraceId(traceId);
        response.setRequestId(requestId);
        return response;
    }

    static StatusResponse toStatusResponse(CatalogGeneration generation, boolean rebuilding) {
        StatusResponse response = new StatusResponse();
        response.setRebuilding(rebuilding);
        if (generation == null) {
            return response;
        }
        HierarchyBuildResult hierarchy = generation.getHierarchy();
        response.setGeneration(generation.getNumber());
        response.setBuiltAt(generation.getBuiltAt() == null ? null : generation.getBuiltAt().toString());
        response.setChapters(generation.getChapters().size());
        response.setTariffNodes(generation.getTree().size());
        response.setIndexEntries(generation.getIndex().size());
        response.setOrphans(hierarchy.orphanKeys().size());
        response.setSkippedRows(hierarchy.skippedRows().size());
        response.setDuplicates(hierarchy.duplicateKeys().size());
        return response;
    }

    private static TextHitDto toTextHit(TextSearchHit hit) {
        TextHitDto dto = new TextHitDto();
        dto.setType(hit.type().name().toLowerCase(Locale.ROOT));
        dto.setId(hit.id());
        dto.setChapter(hit.chapter());
        dto.setTitle(hit.title());
        dto.setSnippet(hit.snippet());
        dto.setAnchor(hit.anchor());
        dto.setTier(hit.tier());
        dto.setScore(hit.score());
        dto.setRank(hit.rank());
        return dto;
    }

    private static List<PositionDto> toPositions(List<Position> positions) {
        List<PositionDto> dtos = new ArrayList<>(positions.size());
        for (Position position : positions) {
            PositionDto dto = new PositionDto();
            dto.setCode(position.code());
            dto.setDescription(position.description());
            dto.setAnchor(position.anchor());
            dtos.add(dto);
        }
        return dtos;
    }

    private static SectionsDto toSections(ChapterSections sections) {
        if (sections == null || sections.isEmpty()) {
            return null;
        }
        SectionsDto dto = new SectionsDto();
        dto.setTitle(sections.title());
        dto.setNotes(sections.notes());
        dto.setConsiderations(sections.considerations());
        dto.setDefinitions(sections.definitions());
        return dto;
    }

    private static List<TariffNodeDto> toNodes(List<TariffNode> nodes) {
        List<TariffNodeDto> dtos = new ArrayList<>(nodes.size());
        for (TariffNode node : nodes) {
            dtos.add(toNode(node));
        }
        return dtos;
    }

    private static TariffNodeDto toNode(TariffNode node) {
        TariffNodeDto dto = new TariffNodeDto();
        dto.setKey(node.getKey());
        dto.setCode(node.getCode());
        dto.setDescription(node.getDescription());
        dto.setRate(node.getRate());
        dto.setLevel(node.getLevel());
        dto.setParentKey(node.getParentKey());
        dto.setSortKey(node.getSortKey());
        dto.setAnchor(AnchorIds.forCode(node.getCode()));
        return dto;
    }
}
