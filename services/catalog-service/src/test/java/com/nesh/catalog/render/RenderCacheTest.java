package com.nesh.catalog.render;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class RenderCacheTest {

    @Test
    void rendersOncePerKey() {
        RenderCache cache = new RenderCache(4);
        AtomicInteger renders = new AtomicInteger();

        for (int i = 0; i < 3; i++) {
            cache.getOrRender("k1", () -> {
                renders.incrementAndGet();
                return rendered("01");
            });
        }

        assertThat(renders.get()).isEqualTo(1);
        assertThat(cache.get("k1").chapter()).isEqualTo("01");
    }

    @Test
    void evictsOldestWhenFull() {
        RenderCache cache = new RenderCache(2);

        cache.getOrRender("k1", () -> rendered("01"));
        cache.getOrRender("k2", () -> rendered("02"));
        cache.getOrRender("k3", () -> rendered("03"));

        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.get("k1")).isNull();
        assertThat(cache.get("k3")).isNotNull();
    }

    @Test
    void clearDropsEverything() {
        RenderCache cache = new RenderCache(2);
        cache.getOrRender("k1", () -> rendered("01"));

        cache.clear();

        assertThat(cache.size()).isZero();
    }

    private RenderedChapter rendered(String chapter) {
        return new RenderedChapter(chapter, "<p>" + chapter + "</p>", List.of(), "hash-" + chapter);
    }
}
