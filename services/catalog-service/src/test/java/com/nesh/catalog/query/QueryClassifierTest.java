package com.nesh.catalog.query;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class QueryClassifierTest {

    private final QueryClassifier classifier = new QueryClassifier();

    @Test
    void commaSeparatedCodesFormCodeBatch() {
        ClassifiedQuery query = classifier.classify(" 85, 73 ");

        assertThat(query.kind()).isEqualTo(QueryKind.CODE);
        assertThat(query.tokens()).extracting(CodeToken::raw).containsExactly("85", "73");
    }

    @Test
    void acceptsDottedPartiallyDottedAndUndottedForms() {
        ClassifiedQuery query = classifier.classify("73.15;8413.1,731500,8413/11-00");

        assertThat(query.isCode()).isTrue();
        assertThat(query.tokens()).extracting(CodeToken::digits)
            .containsExactly("7315", "84131", "731500", "84131100");
    }

    @Test
    void whitespaceSeparatedCodesAreSplit() {
        ClassifiedQuery query = classifier.classify("84 8517");

        assertThat(query.isCode()).isTrue();
        assertThat(query.tokens()).extracting(CodeToken::raw).containsExactly("84", "8517");
    }

    @Test
    void anyNonCodeTokenMakesWholeQueryText() {
        ClassifiedQuery query = classifier.classify("85, bombas");

        assertThat(query.kind()).isEqualTo(QueryKind.TEXT);
        assertThat(query.text()).isEqualTo("85, bombas");
        assertThat(query.tokens()).isEmpty();
    }

    @Test
    void freeTextIsText() {
        assertThat(classifier.classify("bombas centrífugas").kind()).isEqualTo(QueryKind.TEXT);
        assertThat(classifier.classify("bombas 8413").kind()).isEqualTo(QueryKind.TEXT);
    }

    @Test
    void emptyInputIsEmptyTextQuery() {
        assertThat(classifier.classify(null).isEmpty()).isTrue();
        assertThat(classifier.classify("   ").isEmpty()).isTrue();
        assertThat(classifier.classify(",,;").kind()).isEqualTo(QueryKind.TEXT);
    }

    @Test
    void rejectsCodesOutsideDigitBounds() {
        assertThat(classifier.isCodeShaped("8")).isFalse();
        assertThat(classifier.isCodeShaped("841311001")).isFalse();
        assertThat(classifier.isCodeShaped("8413..11")).isFalse();
        assertThat(classifier.isCodeShaped("8413.11.00")).isTrue();
    }

    @Test
    void parsesExceptionMarker() {
        ClassifiedQuery query = classifier.classify("8413.11.00 Ex 01, 8413.11.00ex.2");

        assertThat(query.isCode()).isTrue();
        CodeToken first = query.tokens().get(0);
        assertThat(first.raw()).isEqualTo("8413.11.00 Ex 01");
        assertThat(first.code()).isEqualTo("8413.11.00");
        assertThat(first.exceptionIndex()).isEqualTo(1);
        assertThat(query.tokens().get(1).exceptionIndex()).isEqualTo(2);
    }
}
