package com.nesh.catalog.index;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class TextNormalizerTest {

    @Test
    void foldsAccentsCaseAndPunctuation() {
        assertThat(TextNormalizer.normalize("Bombas  de VÁCUO, ações/produção!")).isEqualTo("bombas de vacuo acoes producao");
        assertThat(TextNormalizer.normalize(null)).isEmpty();
    }

    @Test
    void dropsStopwordsUnlessNothingElseRemains() {
        Set<String> stopwords = Set.of("de", "para", "o");

        assertThat(TextNormalizer.terms("bombas de ar de vacuo", stopwords)).isEqualTo(List.of("bombas", "ar", "vacuo"));
        assertThat(TextNormalizer.terms("de para", stopwords)).isEqualTo(List.of("de", "para"));
    }
}
