package com.nesh.catalog.render;

import com.nesh.catalog.model.Chapter;
import io.micrometer.core.instrument.Metrics;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class ContentRenderer {
    private static final Logger logger = LoggerFactory.getLogger(ContentRenderer.class);

    private final RenderCache cache;
    private final List<RenderRule> rules;

    @Autowired
    public ContentRenderer(RenderCache cache) {
        this(cache, defaultRules());
    }

    ContentRenderer(RenderCache cache, List<RenderRule> rules) {
        this.cache = cache;
        this.rules = List.copyOf(rules);
    }

    public static List<RenderRule> defaultRules() {
        return List.of(
            LineFilterRule.pageMarkers(),
            LineFilterRule.structuralArtifacts(),
            new SuperscriptRule(),
            new BlankLineCollapseRule(),
            new HtmlEscapeRule(),
            new HeadingRule(),
            new SubpositionMarkerRule(),
            new NoteReferenceRule(),
            new SmartLinkRule(),
            new BoldRule(),
            new ListRule(),
            new ParagraphRule()
        );
    }

    public RenderedChapter render(Chapter chapter) {
        String hash = CacheKeyUtil.chapterHash(chapter);
        return cache.getOrRender(hash, () -> renderUncached(chapter, hash));
    }

    public boolean isCached(Chapter chapter) {
        return cache.get(CacheKeyUtil.chapterHash(chapter)) != null;
    }

    RenderedChapter renderUncached(Chapter chapter, String hash) {
        RenderContext context = new RenderContext(chapter.getNumber(), chapter.getNotes(), chapter.getPositions());
        String text = chapter.getContent().replace("\r\n", "\n").replace('\r', '\n');
        for (RenderRule rule : rules) {
            try {
                text = rule.apply(text, context);
            } catch (RuntimeException e) {
                logger.warn("render_irregularity rule={} chapter={} reason={}", rule.name(), chapter.getNumber(), e.toString());
                Metrics.counter("catalog.render.irregularity.total", "rule", rule.name()).increment();
            }
        }
        logger.debug(
            "chapter_rendered chapter={} html_length={} referenced_notes={}",
            chapter.getNumber(),
            text.length(),
            context.getReferencedNotes().size()
        );
        return new RenderedChapter(chapter.getNumber(), text, List.copyOf(context.getReferencedNotes()), hash);
    }
}
