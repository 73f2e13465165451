package com.nesh.catalog.catalog;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class CatalogHolder {
    private static final Logger logger = LoggerFactory.getLogger(CatalogHolder.class);

    private final AtomicReference<CatalogGeneration> active = new AtomicReference<>();
    private final AtomicLong sequence = new AtomicLong();

    public CatalogGeneration current() {
        CatalogGeneration generation = active.get();
        if (generation == null) {
            throw new CatalogUnavailableException("catalog has not been loaded yet");
        }
        return generation;
    }

    public CatalogGeneration currentOrNull() {
        return active.get();
    }

    public long nextGenerationNumber() {
        return sequence.incrementAndGet();
    }

    public CatalogGeneration swap(CatalogGeneration next) {
        CatalogGeneration previous = active.getAndSet(next);
        logger.info(
            "catalog_generation_swapped generation={} previous={} chapters={} tariff_nodes={} index_entries={}",
            next.getNumber(),
            previous == null ? null : previous.getNumber(),
            next.getChapters().size(),
            next.getTree().size(),
            next.getIndex().size()
        );
        return previous;
    }
}
