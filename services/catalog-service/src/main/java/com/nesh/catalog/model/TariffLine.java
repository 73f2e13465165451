package com.nesh.catalog.model;

/**
 * Flat catalog row as ingested, before the hierarchy is computed.
 * {@code exceptionMarker} holds the "Ex" index when the row is an exception sub-line.
 */
public record TariffLine(String code, String exceptionMarker, String description, String rate) {
}
