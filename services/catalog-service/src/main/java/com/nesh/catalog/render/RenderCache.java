package com.nesh.catalog.render;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Supplier;

/**
 * Bounded cache of rendered chapters keyed by content hash. Entries never go stale: a changed
 * chapter hashes to a new key and old keys age out in insertion order.
 */
public class RenderCache {
    private final ConcurrentHashMap<String, RenderedChapter> entries = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<String> order = new ConcurrentLinkedQueue<>();
    private final int maxEntries;

    public RenderCache(int maxEntries) {
        this.maxEntries = Math.max(1, maxEntries);
    }

    public RenderedChapter get(String key) {
        return key == null ? null : entries.get(key);
    }

    public RenderedChapter getOrRender(String key, Supplier<RenderedChapter> renderer) {
        RenderedChapter cached = entries.get(key);
        if (cached != null) {
            return cached;
        }
        boolean[] created = new boolean[1];
        RenderedChapter rendered = entries.computeIfAbsent(key, ignored -> {
            created[0] = true;
            return renderer.get();
        });
        if (created[0]) {
            order.add(key);
            evictIfNeeded();
        }
        return rendered;
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
        order.clear();
    }

    private void evictIfNeeded() {
        while (entries.size() > maxEntries) {
            String key = order.poll();
            if (key == null) {
                break;
            }
            entries.remove(key);
        }
    }
}
