package com.nesh.catalog.render;

import static org.assertj.core.api.Assertions.assertThat;

import com.nesh.catalog.model.Chapter;
import com.nesh.catalog.model.Note;
import com.nesh.catalog.model.Position;
import com.nesh.catalog.support.CatalogFixtures;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ContentRendererTest {

    @Test
    void renderingIsByteStable() {
        Chapter chapter = CatalogFixtures.chapters().get(0);

        RenderedChapter first = new ContentRenderer(new RenderCache(10)).render(chapter);
        RenderedChapter second = new ContentRenderer(new RenderCache(10)).render(chapter);

        assertThat(second.html()).isEqualTo(first.html());
        assertThat(second.contentHash()).isEqualTo(first.contentHash());
    }

    @Test
    void tagsHeadingsWithPositionAnchorsOnce() {
        Chapter chapter = chapter(String.join("\n",
            "**84.13** - Bombas para líquidos",
            "84.13 – Bombas repetidas",
            "8413.11: Bombas para combustíveis",
            "*84.14* — Bombas de ar"
        ));

        String html = new ContentRenderer(new RenderCache(10)).render(chapter).html();

        assertThat(html).contains("<h3 class=\"position\" id=\"pos-84-13\"><span class=\"code\">84.13</span> - Bombas para líquidos</h3>");
        assertThat(html).contains("<h4 class=\"subposition\" id=\"pos-8413-11\">");
        assertThat(html).contains("<h3 class=\"position\" id=\"pos-84-14\">");
        assertThat(html.split("id=\"pos-84-13\"", -1)).hasSize(2);
        assertThat(html).contains(
            "<a class=\"smart-link\" href=\"#pos-84-13\" data-ncm=\"8413\">84.13</a> – Bombas repetidas"
        );
    }

    @Test
    void stripsArtifactsAndCollapsesBlankLines() {
        String html = new ContentRenderer(new RenderCache(10)).render(CatalogFixtures.chapters().get(0)).html();

        assertThat(html).doesNotContain("XV-1234-5");
        assertThat(html).doesNotContain("Página 12");
        assertThat(html).doesNotContain("<p>84.13</p>");
        assertThat(html).doesNotContain("\n\n\n");
    }

    @Test
    void linksKnownNotesAndLeavesUnknownNotesLiteral() {
        RenderedChapter rendered = new ContentRenderer(new RenderCache(10)).render(CatalogFixtures.chapters().get(0));

        assertThat(rendered.html()).contains(
            "Nota <a class=\"note-ref\" href=\"#chapter-84-note-3\" data-note=\"3\">3</a>"
        );
        assertThat(rendered.html()).contains("Nota 9");
        assertThat(rendered.html()).contains("Ver as Notas 1 e 3 do Capítulo 85.");
        assertThat(rendered.referencedNotes()).containsExactly("3");
    }

    @Test
    void escapesMarkupAndConvertsBold() {
        String html = new ContentRenderer(new RenderCache(10))
            .render(chapter("Texto <script>alert(1)</script> com **destaque**"))
            .html();

        assertThat(html).isEqualTo(
            "<p>Texto &lt;script&gt;alert(1)&lt;/script&gt; com <strong>destaque</strong></p>"
        );
    }

    @Test
    void joinsLinesIntoParagraphs() {
        String html = new ContentRenderer(new RenderCache(10))
            .render(chapter("primeira linha\nsegunda linha\n\n\n\nnovo parágrafo"))
            .html();

        assertThat(html).isEqualTo("<p>primeira linha<br>segunda linha</p>\n<p>novo parágrafo</p>");
    }

    @Test
    void failingRulePassesTextThrough() {
        List<RenderRule> rules = new ArrayList<>(ContentRenderer.defaultRules());
        rules.add(1, new RenderRule() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public String apply(String text, RenderContext context) {
                throw new IllegalStateException("boom");
            }
        });
        ContentRenderer renderer = new ContentRenderer(new RenderCache(10), rules);
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        Metrics.addRegistry(meterRegistry);
        try {
            String html = renderer.render(chapter("Bombas **centrífugas**")).html();

            assertThat(html).isEqualTo("<p>Bombas <strong>centrífugas</strong></p>");
            assertThat(meterRegistry.counter("catalog.render.irregularity.total", "rule", "broken").count()).isEqualTo(1.0);
        } finally {
            Metrics.removeRegistry(meterRegistry);
        }
    }

    @Test
    void irregularInputIsNeverDropped() {
        String raw = "-- ** texto solto ** 84.1 - — :: Nota";

        String html = new ContentRenderer(new RenderCache(10)).render(chapter(raw)).html();

        assertThat(html).isEqualTo("<p>-- <strong> texto solto </strong> 84.1 - — :: Nota</p>");
    }

    @Test
    void crossReferencesCodesAndStructuresLists() {
        String html = new ContentRenderer(new RenderCache(10)).render(chapter(String.join("\n",
            "84.13 - Bombas (+)",
            "Excluem-se:",
            "a) as bombas da posição 84.14;",
            "b) os tubos de 2 m [3].",
            "",
            "Ver a Nota 3."
        ))).html();

        assertThat(html).isEqualTo(String.join("\n",
            "<h3 class=\"position\" id=\"pos-84-13\"><span class=\"code\">84.13</span> - Bombas "
                + SubpositionMarkerRule.INDICATOR + "</h3>",
            "<p>Excluem-se:</p>",
            "<ol type=\"a\" class=\"list\"><li>as bombas da posição "
                + "<a class=\"smart-link\" href=\"#pos-84-14\" data-ncm=\"8414\">84.14</a>;</li>"
                + "<li>os tubos de 2 m³.</li></ol>",
            "<p>Ver a Nota <a class=\"note-ref\" href=\"#chapter-84-note-3\" data-note=\"3\">3</a>.</p>"
        ));
    }

    @Test
    void cachesByContentHash() {
        RenderCache cache = new RenderCache(10);
        ContentRenderer renderer = new ContentRenderer(cache);
        Chapter chapter = CatalogFixtures.chapters().get(1);

        RenderedChapter first = renderer.render(chapter);
        RenderedChapter second = renderer.render(chapter);

        assertThat(second).isSameAs(first);
        assertThat(renderer.isCached(chapter)).isTrue();
        assertThat(cache.size()).isEqualTo(1);
    }

    private Chapter chapter(String content) {
        return new Chapter(
            "84",
            "Capítulo de teste",
            content,
            null,
            List.of(new Note("84", "3", "3.- Nota de teste")),
            List.of(Position.of("84", "84.13", "Bombas"), Position.of("84", "84.14", "Bombas de ar"))
        );
    }
}
