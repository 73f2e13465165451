package com.nesh.catalog.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ErrorResponse {
    private final ErrorDetail error;

    @JsonProperty("trace_id")
    private final String traceId;

    @JsonProperty("request_id")
    private final String requestId;

    public ErrorResponse(String code, String message, String traceId, String requestId) {
        this.error = new ErrorDetail(code, message);
        this.traceId = traceId;
        this.requestId = requestId;
    }

    public ErrorDetail getError() {
        return error;
    }

    public String getTraceId() {
        return traceId;
    }

    public String getRequestId() {
        return requestId;
    }

    public record ErrorDetail(String code, String message) {
    }
}
