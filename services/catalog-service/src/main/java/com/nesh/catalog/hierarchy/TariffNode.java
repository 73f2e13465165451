package com.nesh.catalog.hierarchy;

public class TariffNode {
    private final String key;
    private final String code;
    private final String digits;
    private final Integer exceptionIndex;
    private final String description;
    private final String rate;
    private final int level;
    private final String parentKey;
    private final String sortKey;
    private final String sourceCode;
    private final String sourceMarker;

    public TariffNode(
        String key,
        String code,
        String digits,
        Integer exceptionIndex,
        String description,
        String rate,
        int level,
        String parentKey,
        String sortKey,
        String sourceCode,
        String sourceMarker
    ) {
        this.key = key;
        this.code = code;
        this.digits = digits;
        this.exceptionIndex = exceptionIndex;
        this.description = description;
        this.rate = rate;
        this.level = level;
        this.parentKey = parentKey;
        this.sortKey = sortKey;
        this.sourceCode = sourceCode;
        this.sourceMarker = sourceMarker;
    }

    public String getKey() {
        return key;
    }

    public String getCode() {
        return code;
    }

    public String getDigits() {
        return digits;
    }

    public Integer getExceptionIndex() {
        return exceptionIndex;
    }

    public boolean isException() {
        return exceptionIndex != null;
    }

    public String getChapter() {
        return digits.substring(0, 2);
    }

    public String getDescription() {
        return description;
    }

    public String getRate() {
        return rate;
    }

    public int getLevel() {
        return level;
    }

    public String getParentKey() {
        return parentKey;
    }

    public String getSortKey() {
        return sortKey;
    }

    public String getSourceCode() {
        return sourceCode;
    }

    public String getSourceMarker() {
        return sourceMarker;
    }

    @Override
    public String toString() {
        return "TariffNode{" + key + ", level=" + level + ", parent=" + parentKey + "}";
    }
}
