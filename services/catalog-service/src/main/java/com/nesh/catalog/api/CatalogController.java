package com.nesh.catalog.api;

import com.nesh.catalog.api.dto.ChapterListResponse;
import com.nesh.catalog.api.dto.ChapterSummaryDto;
import com.nesh.catalog.api.dto.ErrorResponse;
import com.nesh.catalog.api.dto.RebuildResponse;
import com.nesh.catalog.api.dto.StatusResponse;
import com.nesh.catalog.common.JdbcUtils;
import com.nesh.catalog.model.Chapter;
import com.nesh.catalog.service.CatalogRebuildService;
import com.nesh.catalog.service.CatalogSearchResult;
import com.nesh.catalog.service.CatalogSearchService;
import com.nesh.catalog.service.CatalogSearchService.ChapterListing;
import com.nesh.catalog.service.CatalogSearchService.ChapterView;
import com.nesh.catalog.service.RebuildOutcome;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class CatalogController {
    private final CatalogSearchService searchService;
    private final CatalogRebuildService rebuildService;

    public CatalogController(CatalogSearchService searchService, CatalogRebuildService rebuildService) {
        this.searchService = searchService;
        this.rebuildService = rebuildService;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @GetMapping("/search")
    public ResponseEntity<?> search(
        @RequestParam(value = "q", required = false) String query,
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader
    ) {
        String traceId = RequestIdUtil.resolveOrGenerate(traceIdHeader);
        String requestId = RequestIdUtil.resolveOrGenerate(requestIdHeader);
        CatalogSearchResult result = searchService.search(query);
        return ResponseEntity.ok(ResponseMapper.toSearchResponse(result, traceId, requestId));
    }

    @GetMapping("/chapters")
    public ResponseEntity<?> chapters(
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader
    ) {
        String traceId = RequestIdUtil.resolveOrGenerate(traceIdHeader);
        String requestId = RequestIdUtil.resolveOrGenerate(requestIdHeader);
        ChapterListing listing = searchService.listChapters();
        List<ChapterSummaryDto> chapters = new ArrayList<>(listing.chapters().size());
        for (Chapter chapter : listing.chapters()) {
            chapters.add(ResponseMapper.toChapterSummary(chapter));
        }
        ChapterListResponse response = new ChapterListResponse();
        response.setChapters(chapters);
        response.setGeneration(listing.generation());
        response.setTraceId(traceId);
        response.setRequestId(requestId);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/chapters/{chapter}")
    public ResponseEntity<?> chapter(
        @PathVariable("chapter") String chapter,
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader
    ) {
        String traceId = RequestIdUtil.resolveOrGenerate(traceIdHeader);
        String requestId = RequestIdUtil.resolveOrGenerate(requestIdHeader);
        String chapterNumber = JdbcUtils.asChapterNumber(chapter);
        if (chapterNumber == null) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", "chapter must be a number between 0 and 99", traceId, requestId)
            );
        }
        Optional<ChapterView> view = searchService.findChapter(chapterNumber);
        if (view.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(
                new ErrorResponse("not_found", "chapter " + chapterNumber + " not found", traceId, requestId)
            );
        }
        return ResponseEntity.ok(ResponseMapper.toChapterResponse(view.get(), traceId, requestId));
    }

    @PostMapping("/internal/rebuild/hierarchy")
    public ResponseEntity<RebuildResponse> rebuildHierarchy(
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader
    ) {
        return rebuild(rebuildService::rebuildHierarchy, traceIdHeader, requestIdHeader);
    }

    @PostMapping("/internal/rebuild/index")
    public ResponseEntity<RebuildResponse> rebuildIndex(
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader
    ) {
        return rebuild(rebuildService::rebuildIndex, traceIdHeader, requestIdHeader);
    }

    @PostMapping("/internal/reload")
    public ResponseEntity<RebuildResponse> reload(
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader
    ) {
        return rebuild(rebuildService::reload, traceIdHeader, requestIdHeader);
    }

    @GetMapping("/internal/status")
    public ResponseEntity<StatusResponse> status(
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader
    ) {
        StatusResponse response = ResponseMapper.toStatusResponse(
            rebuildService.activeGeneration(),
            rebuildService.isRebuilding()
        );
        response.setTraceId(RequestIdUtil.resolveOrGenerate(traceIdHeader));
        response.setRequestId(RequestIdUtil.resolveOrGenerate(requestIdHeader));
        return ResponseEntity.ok(response);
    }

    private ResponseEntity<RebuildResponse> rebuild(
        Supplier<RebuildOutcome> operation,
        String traceIdHeader,
        String requestIdHeader
    ) {
        String traceId = RequestIdUtil.resolveOrGenerate(traceIdHeader);
        String requestId = RequestIdUtil.resolveOrGenerate(requestIdHeader);
        RebuildOutcome outcome = operation.get();
        RebuildResponse body = ResponseMapper.toRebuildResponse(outcome, traceId, requestId);
        switch (outcome.status()) {
            case IN_PROGRESS:
                return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
            case FAILED:
                return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
            default:
                return ResponseEntity.ok(body);
        }
    }
}
