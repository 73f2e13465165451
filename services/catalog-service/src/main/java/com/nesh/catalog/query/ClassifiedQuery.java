package com.nesh.catalog.query;

import java.util.List;

public record ClassifiedQuery(QueryKind kind, String text, List<CodeToken> tokens) {

    public static ClassifiedQuery code(String text, List<CodeToken> tokens) {
        return new ClassifiedQuery(QueryKind.CODE, text, List.copyOf(tokens));
    }

    public static ClassifiedQuery text(String text) {
        return new ClassifiedQuery(QueryKind.TEXT, text == null ? "" : text, List.of());
    }

    public boolean isCode() {
        return kind == QueryKind.CODE;
    }

    public boolean isEmpty() {
        return kind == QueryKind.TEXT && text.isBlank();
    }
}
