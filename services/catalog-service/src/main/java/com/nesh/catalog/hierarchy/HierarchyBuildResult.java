package com.nesh.catalog.hierarchy;

import java.util.List;

public record HierarchyBuildResult(
    TariffTree tree,
    List<String> orphanKeys,
    List<SkippedRow> skippedRows,
    List<String> duplicateKeys
) {

    public record SkippedRow(String code, String exceptionMarker, String reason) {
    }
}
