package com.kmesh.fusion.api;

import com.kmesh.fusion.api.dto.FuseRequest;
import com.kmesh.fusion.api.dto.FusionResult;
import com.kmesh.fusion.pipeline.FusionPipeline;
import com.kmesh.fusion.pipeline.FusionPipelineException;
import com.kmesh.fusion.pipeline.InvalidFuseRequestException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class FusionController {
    private final FusionPipeline fusionPipeline;

    public FusionController(FusionPipeline fusionPipeline) {
        this.fusionPipeline = fusionPipeline;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @PostMapping("/fuse")
    public ResponseEntity<?> fuse(
        @RequestBody(required = false) FuseRequest request,
        @RequestHeader(value = "x-trace-id", required = false) String traceHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestHeader
    ) {
        FuseCallContext call = FuseCallContext.resolve(traceHeader, requestHeader, request);
        try {
            FusionResult result = fusionPipeline.fuse(request, call.traceId());
            return ResponseEntity.ok(result);
        } catch (InvalidFuseRequestException e) {
            return ResponseEntity.badRequest().body(call.error("bad_request", e.getMessage()));
        } catch (FusionPipelineException e) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
                call.error("pipeline_error", e.getMessage())
            );
        }
    }
}
