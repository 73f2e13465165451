package com.nesh.catalog.render;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LineFilterRuleTest {

    private final RenderContext context = new RenderContext("84", Map.of(), List.of());

    @Test
    void removesInternalReferencesAndCodeEchoes() {
        String text = String.join("\n",
            "84.13 - Bombas",
            "XV-1234-5",
            "IV-2020-12",
            "84.13",
            "**84.13.10**",
            "-",
            "- *",
            "*",
            "Bombas centrífugas"
        );

        String out = LineFilterRule.structuralArtifacts().apply(text, context);

        assertThat(out).isEqualTo("84.13 - Bombas\nBombas centrífugas");
    }

    @Test
    void keepsCodesThatArePartOfSentences() {
        String text = "ver a posição 84.13\n84.13 e 84.14";

        assertThat(LineFilterRule.structuralArtifacts().apply(text, context)).isEqualTo(text);
    }

    @Test
    void removesPageMarkers() {
        String out = LineFilterRule.pageMarkers().apply("linha\nPágina 12\n  Pagina 3 \noutra", context);

        assertThat(out).isEqualTo("linha\noutra");
    }
}
