package com.nesh.catalog.render;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class NoteReferenceRuleTest {

    private final NoteReferenceRule rule = new NoteReferenceRule();

    @Test
    void linksSingularReference() {
        RenderContext context = context();

        String out = rule.apply("See Note 2 for details.", context);

        assertThat(out).isEqualTo("See Note " + link("2") + " for details.");
        assertThat(context.getReferencedNotes()).containsExactly("2");
    }

    @Test
    void linksEveryNumberInConjunctionList() {
        String out = rule.apply("Notes 1, 2 and 4 apply; ver Notas 1 e 2.", context());

        assertThat(out).isEqualTo(
            "Notes " + link("1") + ", " + link("2") + " and 4 apply; ver Notas " + link("1") + " e " + link("2") + "."
        );
    }

    @Test
    void linksListWithConjunctionAfterFinalComma() {
        RenderContext context = new RenderContext("84", Map.of("1", "a", "2", "b", "3", "c"), List.of());

        String out = rule.apply("See Notes 1, 2, and 3 here; Notas 1, 2, e 3.", context);

        assertThat(out).isEqualTo(
            "See Notes " + link("1") + ", " + link("2") + ", and " + link("3") + " here; Notas "
                + link("1") + ", " + link("2") + ", e " + link("3") + "."
        );
        assertThat(context.getReferencedNotes()).containsExactly("1", "2", "3");
    }

    @Test
    void isCaseInsensitive() {
        assertThat(rule.apply("NOTE 1", context())).isEqualTo("NOTE " + link("1"));
        assertThat(rule.apply("nota 1", context())).isEqualTo("nota " + link("1"));
    }

    @Test
    void leavesUnresolvableReferenceLiteral() {
        RenderContext context = context();

        String out = rule.apply("Note 9 does not exist.", context);

        assertThat(out).isEqualTo("Note 9 does not exist.");
        assertThat(context.getReferencedNotes()).isEmpty();
    }

    @Test
    void leavesReferencesToOtherChaptersLiteral() {
        assertThat(rule.apply("Note 1 of Chapter 85", context())).isEqualTo("Note 1 of Chapter 85");
        assertThat(rule.apply("Nota 2 do Capítulo 73", context())).isEqualTo("Nota 2 do Capítulo 73");
    }

    @Test
    void linksReferencesQualifiedWithOwnChapter() {
        assertThat(rule.apply("Nota 2 do Capítulo 84", context()))
            .isEqualTo("Nota " + link("2") + " do Capítulo 84");
    }

    @Test
    void ignoresWordsThatOnlyContainNote() {
        assertThat(rule.apply("denotes 1 footnote 2", context())).isEqualTo("denotes 1 footnote 2");
    }

    private RenderContext context() {
        return new RenderContext("84", Map.of("1", "first", "2", "second"), List.of());
    }

    private String link(String number) {
        return "<a class=\"note-ref\" href=\"#chapter-84-note-" + number + "\" data-note=\"" + number + "\">"
            + number + "</a>";
    }
}
