package com.nesh.catalog.query;

public enum QueryKind {
    CODE,
    TEXT
}
