package com.nesh.catalog.api;

import jakarta.servlet.http.HttpServletRequest;
import java.util.UUID;

public final class RequestIdUtil {
    public static final String TRACE_ID_HEADER = "x-trace-id";
    public static final String REQUEST_ID_HEADER = "x-request-id";

    private RequestIdUtil() {
    }

    public static String resolveOrGenerate(String value) {
        if (value != null && !value.isBlank()) {
            return value.trim();
        }
        return UUID.randomUUID().toString();
    }

    public static String resolveOrGenerate(HttpServletRequest request, String headerName) {
        return resolveOrGenerate(request == null ? null : request.getHeader(headerName));
    }
}
