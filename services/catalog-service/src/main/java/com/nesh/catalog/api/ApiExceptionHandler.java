package com.nesh.catalog.api;

import com.nesh.catalog.api.dto.ErrorResponse;
import com.nesh.catalog.catalog.CatalogUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(
        HttpRequestMethodNotSupportedException ex,
        HttpServletRequest request
    ) {
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).body(
            errorResponse("method_not_allowed", ex.getMessage(), request)
        );
    }

    @ExceptionHandler(CatalogUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleCatalogUnavailable(CatalogUnavailableException ex, HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(
            errorResponse("catalog_unavailable", ex.getMessage(), request)
        );
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        ErrorResponse body = errorResponse("internal_error", "Unexpected error", request);
        logger.error(
            "unexpected_exception request_id={} trace_id={} method={} path={}",
            body.getRequestId(),
            body.getTraceId(),
            request == null ? null : request.getMethod(),
            request == null ? null : request.getRequestURI(),
            ex
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private ErrorResponse errorResponse(String code, String message, HttpServletRequest request) {
        String traceId = RequestIdUtil.resolveOrGenerate(request, RequestIdUtil.TRACE_ID_HEADER);
        String requestId = RequestIdUtil.resolveOrGenerate(request, RequestIdUtil.REQUEST_ID_HEADER);
        return new ErrorResponse(code, message, traceId, requestId);
    }
}
