package com.nesh.catalog.index;

public enum EntryType {
    CHAPTER,
    POSITION,
    TARIFF_LINE
}
