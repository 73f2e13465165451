package com.nesh.catalog.model;

public record Position(String code, String description, String anchor, String chapter) {

    public static Position of(String chapter, String code, String description) {
        return new Position(code, description, AnchorIds.forCode(code), chapter);
    }
}
