package com.nesh.catalog.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class StatusResponse {
    private Long generation;

    @JsonProperty("built_at")
    private String builtAt;

    private Integer chapters;

    @JsonProperty("tariff_nodes")
    private Integer tariffNodes;

    @JsonProperty("index_entries")
    private Integer indexEntries;

    private Integer orphans;

    @JsonProperty("skipped_rows")
    private Integer skippedRows;

    private Integer duplicates;
    private boolean rebuilding;

    @JsonProperty("trace_id")
    private String traceId;

    @JsonProperty("request_id")
    private String requestId;

    public Long getGeneration() {
        return generation;
    }

    public void setGeneration(Long generation) {
        this.generation = generation;
    }

    public String getBuiltAt() {
        return builtAt;
    }

    public void setBuiltAt(String builtAt) {
        this.builtAt = builtAt;
    }

    public Integer getChapters() {
        return chapters;
    }

    public void setChapters(Integer chapters) {
        this.chapters = chapters;
    }

    public Integer getTariffNodes() {
        return tariffNodes;
    }

    public void setTariffNodes(Integer tariffNodes) {
        this.tariffNodes = tariffNodes;
    }

    public Integer getIndexEntries() {
        return indexEntries;
    }

    public void setIndexEntries(Integer indexEntries) {
        this.indexEntries = indexEntries;
    }

    public Integer getOrphans() {
        return orphans;
    }

    public void setOrphans(Integer orphans) {
        this.orphans = orphans;
    }

    public Integer getSkippedRows() {
        return skippedRows;
    }

    public void setSkippedRows(Integer skippedRows) {
        this.skippedRows = skippedRows;
    }

    public Integer getDuplicates() {
        return duplicates;
    }

    public void setDuplicates(Integer duplicates) {
        this.duplicates = duplicates;
    }

    public boolean isRebuilding() {
        return rebuilding;
    }

    public void setRebuilding(boolean rebuilding) {
        this.rebuilding = rebuilding;
    }

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }
}
