package com.nesh.catalog.service;

public enum RebuildStatus {
    COMPLETED,
    IN_PROGRESS,
    FAILED
}
