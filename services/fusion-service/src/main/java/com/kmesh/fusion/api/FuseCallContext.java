package com.kmesh.fusion.api;

import com.kmesh.fusion.api.dto.ErrorResponse;
import com.kmesh.fusion.api.dto.FuseRequest;
import jakarta.servlet.http.HttpServletRequest;
import java.util.UUID;

/**
 * Ids for one /fuse call. The router sends its trace id both as a header and in the body;
 * the header wins, the body is the fallback for callers that only fill the payload.
 */
record FuseCallContext(String traceId, String requestId) {

    static FuseCallContext resolve(String traceHeader, String requestHeader, FuseRequest body) {
        String traceId = present(traceHeader)
            ? traceHeader.trim()
            : body != null && present(body.getTraceId()) ? body.getTraceId() : UUID.randomUUID().toString();
        String requestId = present(requestHeader) ? requestHeader.trim() : UUID.randomUUID().toString();
        return new FuseCallContext(traceId, requestId);
    }

    static FuseCallContext from(HttpServletRequest request) {
        return resolve(request.getHeader("x-trace-id"), request.getHeader("x-request-id"), null);
    }

    ErrorResponse error(String code, String message) {
        return new ErrorResponse(code, message, traceId, requestId);
    }

    private static boolean present(String value) {
        return value != null && !value.isBlank();
    }
}
