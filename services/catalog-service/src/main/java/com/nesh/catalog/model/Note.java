package com.nesh.catalog.model;

public record Note(String chapter, String number, String text) {

    public String anchor() {
        return AnchorIds.forNote(chapter, number);
    }
}
