package com.nesh.catalog.render;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TextCleanupRulesTest {

    private final RenderContext context = new RenderContext("84", Map.of(), List.of());

    @Test
    void bracketedExponentsBecomeSuperscripts() {
        SuperscriptRule rule = new SuperscriptRule();

        assertThat(rule.apply("área em m [2] e volume em cm[ 3 ]", context)).isEqualTo("área em m² e volume em cm³");
        assertThat(rule.apply("ver [4] e [12]", context)).isEqualTo("ver [4] e [12]");
    }

    @Test
    void plusMarkerBecomesIndicator() {
        SubpositionMarkerRule rule = new SubpositionMarkerRule();

        assertThat(rule.apply("Bombas (+)\nAr(+) comprimido", context)).isEqualTo(
            "Bombas " + SubpositionMarkerRule.INDICATOR + "\nAr " + SubpositionMarkerRule.INDICATOR + " comprimido"
        );
        assertThat(rule.apply("soma (a+b)", context)).isEqualTo("soma (a+b)");
    }
}
