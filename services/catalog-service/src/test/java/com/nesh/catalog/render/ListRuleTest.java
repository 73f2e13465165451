package com.nesh.catalog.render;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ListRuleTest {

    private final ListRule rule = new ListRule();
    private final RenderContext context = new RenderContext("84", Map.of(), List.of());

    @Test
    void groupsLetterItemsIntoOneList() {
        String out = rule.apply("Compreende:\na) as bombas;\nb) os compressores.\nFim", context);

        assertThat(out).isEqualTo(
            "Compreende:\n<ol type=\"a\" class=\"list\"><li>as bombas;</li><li>os compressores.</li></ol>\nFim"
        );
    }

    @Test
    void numberListsOmitTypeAndRomanListsKeepIt() {
        assertThat(rule.apply("1) primeiro\n2. segundo", context))
            .isEqualTo("<ol class=\"list\"><li>primeiro</li><li>segundo</li></ol>");
        assertThat(rule.apply("I. grupo\nII) grupo", context))
            .isEqualTo("<ol type=\"I\" class=\"list\"><li>grupo</li><li>grupo</li></ol>");
    }

    @Test
    void blankLineOrStyleChangeStartsNewList() {
        String out = rule.apply("a) um\n\nb) dois\n1. três", context);

        assertThat(out).isEqualTo(String.join("\n",
            "<ol type=\"a\" class=\"list\"><li>um</li></ol>",
            "",
            "<ol type=\"a\" class=\"list\"><li>dois</li></ol>",
            "<ol class=\"list\"><li>três</li></ol>"
        ));
    }

    @Test
    void leavesNoteNumberingAndHeadingsAsText() {
        String text = "1.- Este Capítulo não compreende as mós.\n84.13 - Bombas\na)sem espaço";

        assertThat(rule.apply(text, context)).isEqualTo(text);
    }
}
