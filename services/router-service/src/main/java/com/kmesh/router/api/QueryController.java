package com.kmesh.router.api;

import com.kmesh.router.api.dto.QueryRequest;
import com.kmesh.router.fusion.FusionUnavailableException;
import com.kmesh.router.routing.InvalidQueryException;
import com.kmesh.router.service.QueryService;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class QueryController {
    private final QueryService queryService;

    public QueryController(QueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @PostMapping("/query")
    public ResponseEntity<?> query(
        @RequestBody(required = false) QueryRequest request,
        @RequestHeader(value = "x-trace-id", required = false) String traceHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestHeader
    ) {
        QueryCallContext call = QueryCallContext.fromHeaders(traceHeader, requestHeader);
        try {
            return ResponseEntity.ok(queryService.query(request, call.traceId(), call.requestId()));
        } catch (InvalidQueryException e) {
            return ResponseEntity.badRequest().body(call.error("bad_request", e.getMessage()));
        } catch (FusionUnavailableException e) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(call.error("fusion_unavailable", e.getMessage()));
        }
    }

    @PostMapping("/route")
    public ResponseEntity<?> route(
        @RequestBody(required = false) QueryRequest request,
        @RequestHeader(value = "x-trace-id", required = false) String traceHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestHeader
    ) {
        QueryCallContext call = QueryCallContext.fromHeaders(traceHeader, requestHeader);
        try {
            return ResponseEntity.ok(queryService.route(request, call.traceId()));
        } catch (InvalidQueryException e) {
            return ResponseEntity.badRequest().body(call.error("bad_request", e.getMessage()));
        }
    }
}
