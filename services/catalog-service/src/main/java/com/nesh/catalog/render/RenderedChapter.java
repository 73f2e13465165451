package com.nesh.catalog.render;

import java.util.List;

public record RenderedChapter(String chapter, String html, List<String> referencedNotes, String contentHash) {
}
