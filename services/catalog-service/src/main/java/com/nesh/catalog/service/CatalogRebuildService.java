package com.nesh.catalog.service;

import com.nesh.catalog.catalog.CatalogGeneration;
import com.nesh.catalog.catalog.CatalogHolder;
import com.nesh.catalog.catalog.CatalogLoadException;
import com.nesh.catalog.catalog.CatalogLoader;
import com.nesh.catalog.catalog.CatalogProperties;
import com.nesh.catalog.catalog.CatalogRepository;
import com.nesh.catalog.hierarchy.HierarchyBuildResult;
import com.nesh.catalog.hierarchy.HierarchyBuilder;
import com.nesh.catalog.hierarchy.TariffNode;
import com.nesh.catalog.hierarchy.TariffTree;
import com.nesh.catalog.index.TextIndex;
import com.nesh.catalog.index.TextIndexBuilder;
import com.nesh.catalog.model.Chapter;
import com.nesh.catalog.model.TariffLine;
import com.nesh.catalog.render.ContentRenderer;
import io.micrometer.core.instrument.Metrics;
import jakarta.annotation.PostConstruct;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Batch entrypoints that build a new catalog generation and swap it in. Only one rebuild runs at a
 * time; a request arriving meanwhile gets {@link RebuildStatus#IN_PROGRESS} and the active
 * generation keeps serving.
 */
@Service
public class CatalogRebuildService {
    private static final Logger logger = LoggerFactory.getLogger(CatalogRebuildService.class);

    public static final String OP_RELOAD = "reload";
    public static final String OP_HIERARCHY = "rebuild_hierarchy";
    public static final String OP_INDEX = "rebuild_index";

    private final ReentrantLock rebuildLock = new ReentrantLock();
    private final CatalogLoader loader;
    private final HierarchyBuilder hierarchyBuilder;
    private final TextIndexBuilder indexBuilder;
    private final ContentRenderer renderer;
    private final CatalogRepository repository;
    private final CatalogHolder catalogHolder;
    private final CatalogProperties properties;
    private final ExecutorService prewarmExecutor;

    public CatalogRebuildService(
        CatalogLoader loader,
        HierarchyBuilder hierarchyBuilder,
        TextIndexBuilder indexBuilder,
        ContentRenderer renderer,
        CatalogRepository repository,
        CatalogHolder catalogHolder,
        CatalogProperties properties,
        @Qualifier("renderPrewarmExecutor") ExecutorService prewarmExecutor
    ) {
        this.loader = loader;
        this.hierarchyBuilder = hierarchyBuilder;
        this.indexBuilder = indexBuilder;
        this.renderer = renderer;
        this.repository = repository;
        this.catalogHolder = catalogHolder;
        this.properties = properties;
        this.prewarmExecutor = prewarmExecutor;
    }

    @PostConstruct
    public void loadOnStartup() {
        if (!properties.isLoadOnStartup()) {
            logger.info("catalog_startup_load_skipped");
            return;
        }
        RebuildOutcome outcome = reload();
        if (outcome.status() != RebuildStatus.COMPLETED) {
            logger.warn("catalog_startup_load_failed status={} message={}", outcome.status(), outcome.message());
        }
    }

    public RebuildOutcome reload() {
        return runExclusive(OP_RELOAD, this::buildFullGeneration);
    }

    public RebuildOutcome rebuildHierarchy() {
        return runExclusive(OP_HIERARCHY, () -> {
            CatalogGeneration active = catalogHolder.currentOrNull();
            if (active == null) {
                return buildFullGeneration();
            }
            HierarchyBuildResult hierarchy = buildHierarchy(chapterNumbers(active.getChapters()));
            TextIndex index = indexBuilder.build(active.getChapters(), hierarchy.tree());
            return active.withHierarchy(catalogHolder.nextGenerationNumber(), hierarchy, index);
        });
    }

    public RebuildOutcome rebuildIndex() {
        return runExclusive(OP_INDEX, () -> {
            CatalogGeneration active = catalogHolder.currentOrNull();
            if (active == null) {
                return buildFullGeneration();
            }
            TextIndex index = indexBuilder.build(active.getChapters(), active.getTree());
            return active.withIndex(catalogHolder.nextGenerationNumber(), index);
        });
    }

    public CatalogGeneration activeGeneration() {
        return catalogHolder.currentOrNull();
    }

    public boolean isRebuilding() {
        return rebuildLock.isLocked();
    }

    private RebuildOutcome runExclusive(String operation, Supplier<CatalogGeneration> task) {
        CatalogGeneration active = catalogHolder.currentOrNull();
        Long activeNumber = active == null ? null : active.getNumber();
        if (!rebuildLock.tryLock()) {
            logger.info("catalog_rebuild_in_progress operation={} active_generation={}", operation, activeNumber);
            Metrics.counter("catalog.rebuild.total", "operation", operation, "status", "in_progress").increment();
            return RebuildOutcome.inProgress(operation, activeNumber);
        }
        long started = System.nanoTime();
        try {
            logger.info("catalog_rebuild_started operation={} active_generation={}", operation, activeNumber);
            CatalogGeneration next = task.get();
            catalogHolder.swap(next);
            long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            HierarchyBuildResult hierarchy = next.getHierarchy();
            logger.info("catalog_rebuild_completed operation={} generation={} took_ms={}", operation, next.getNumber(), tookMs);
            Metrics.counter("catalog.rebuild.total", "operation", operation, "status", "completed").increment();
            return new RebuildOutcome(
                operation,
                RebuildStatus.COMPLETED,
                next.getNumber(),
                next.getChapters().size(),
                next.getTree().size(),
                next.getIndex().size(),
                hierarchy.orphanKeys().size(),
                hierarchy.skippedRows().size(),
                hierarchy.duplicateKeys().size(),
                tookMs,
                null
            );
        } catch (RuntimeException e) {
            long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            logger.error("catalog_rebuild_failed operation={} active_generation={} took_ms={}", operation, activeNumber, tookMs, e);
            Metrics.counter("catalog.rebuild.total", "operation", operation, "status", "failed").increment();
            return RebuildOutcome.failed(operation, activeNumber, tookMs, e.getMessage());
        } finally {
            rebuildLock.unlock();
        }
    }

    private CatalogGeneration buildFullGeneration() {
        List<Chapter> chapters = loader.loadChapters();
        HierarchyBuildResult hierarchy = buildHierarchy(chapterNumbers(chapters));
        TextIndex index = indexBuilder.build(chapters, hierarchy.tree());
        CatalogGeneration generation = new CatalogGeneration(
            catalogHolder.nextGenerationNumber(),
            Instant.now(),
            chapters,
            hierarchy,
            index
        );
        prewarm(generation);
        return generation;
    }

    private HierarchyBuildResult buildHierarchy(Set<String> knownChapters) {
        List<TariffLine> rows = loader.loadTariffLines();
        HierarchyBuildResult hierarchy = hierarchyBuilder.build(rows, knownChapters);
        if (properties.getHierarchy().isWriteBack()) {
            writeBack(hierarchy.tree());
        }
        return hierarchy;
    }

    private void writeBack(TariffTree tree) {
        Map<String, String> parentCodes = new HashMap<>();
        for (TariffNode node : tree.ordered()) {
            TariffNode parent = tree.parent(node);
            if (parent != null) {
                parentCodes.put(node.getKey(), parent.getCode());
            }
        }
        try {
            int updated = repository.updateHierarchy(
                tree.ordered(),
                parentCodes,
                properties.getHierarchy().getWriteBackBatchSize()
            );
            logger.info("hierarchy_written_back nodes={} updated_rows={}", tree.size(), updated);
        } catch (DataAccessException e) {
            throw new CatalogLoadException("failed to write hierarchy back to tariff_lines", e);
        }
    }

    private void prewarm(CatalogGeneration generation) {
        if (!properties.getRender().isPrewarm()) {
            return;
        }
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (Chapter chapter : generation.getChapters()) {
            futures.add(CompletableFuture.runAsync(() -> renderer.render(chapter), prewarmExecutor));
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            logger.info("render_prewarm_completed generation={} chapters={}", generation.getNumber(), futures.size());
        } catch (CompletionException e) {
            logger.warn("render_prewarm_incomplete generation={} reason={}", generation.getNumber(), e.getCause() == null ? e.toString() : e.getCause().toString());
        }
    }

    private Set<String> chapterNumbers(Collection<Chapter> chapters) {
        Set<String> numbers = new LinkedHashSet<>();
        for (Chapter chapter : chapters) {
            numbers.add(chapter.getNumber());
        }
        return numbers;
    }
}
