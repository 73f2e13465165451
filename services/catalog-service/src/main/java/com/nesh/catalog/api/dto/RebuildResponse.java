package com.nesh.catalog.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class RebuildResponse {
    private String operation;
    private String status;
    private Long generation;
    private Integer chapters;

    @JsonProperty("tariff_nodes")
    private Integer tariffNodes;

    @JsonProperty("index_entries")
    private Integer indexEntries;

    private Integer orphans;

    @JsonProperty("skipped_rows")
    private Integer skippedRows;

    private Integer duplicates;

    @JsonProperty("took_ms")
    private Long tookMs;

    private String message;

    @JsonProperty("trace_id")
    private String traceId;

    @JsonProperty("request_id")
    private String requestId;

    public String getOperation() {
        return operation;
    }

    public void setOperation(String operation) {
        this.operation = operation;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Long getGeneration() {
        return generation;
    }

    public void setGeneration(Long generation) {
        this.generation = generation;
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

    public Long getTookMs() {
        return tookMs;
    }

    public void setTookMs(Long tookMs) {
        this.tookMs = tookMs;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
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
