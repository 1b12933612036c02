package com.kmesh.router.api;

import com.kmesh.router.api.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import java.util.UUID;

/**
 * Trace and request ids carried by one /query or /route call. The trace id follows the query
 * through classification, every agent call and fusion; the request id only tags this hop.
 * Missing or blank headers get a fresh UUID.
 */
public record QueryCallContext(String traceId, String requestId) {
    static final String TRACE_HEADER = "x-trace-id";
    static final String REQUEST_HEADER = "x-request-id";

    public static QueryCallContext fromHeaders(String traceHeader, String requestHeader) {
        return new QueryCallContext(orNewId(traceHeader), orNewId(requestHeader));
    }

    public static QueryCallContext from(HttpServletRequest request) {
        return fromHeaders(request.getHeader(TRACE_HEADER), request.getHeader(REQUEST_HEADER));
    }

    public ErrorResponse error(String code, String message) {
        return new ErrorResponse(code, message, traceId, requestId);
    }

    private static String orNewId(String header) {
        if (header == null || header.isBlank()) {
            return UUID.randomUUID().toString();
        }
        return header.trim();
    }
}
