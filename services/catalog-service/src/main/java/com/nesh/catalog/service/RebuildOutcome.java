package com.nesh.catalog.service;

public record RebuildOutcome(
    String operation,
    RebuildStatus status,
    Long generation,
    int chapters,
    int tariffNodes,
    int indexEntries,
    int orphans,
    int skippedRows,
    int duplicates,
    long tookMs,
    String message
) {

    public static RebuildOutcome inProgress(String operation, Long activeGeneration) {
        return new RebuildOutcome(
            operation,
            RebuildStatus.IN_PROGRESS,
            activeGeneration,
            0,
            0,
            0,
            0,
            0,
            0,
            0L,
            "rebuild already running; generation " + activeGeneration + " keeps serving"
        );
    }

    public static RebuildOutcome failed(String operation, Long activeGeneration, long tookMs, String message) {
        return new RebuildOutcome(operation, RebuildStatus.FAILED, activeGeneration, 0, 0, 0, 0, 0, 0, tookMs, message);
    }
}
