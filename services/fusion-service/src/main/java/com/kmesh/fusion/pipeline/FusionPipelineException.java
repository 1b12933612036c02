package com.kmesh.fusion.pipeline;

/**
 * Unrecoverable fault inside a fusion stage, typically input that violates an item invariant.
 */
public class FusionPipelineException extends RuntimeException {
    private final String stage;

    public FusionPipelineException(String stage, String message) {
        super(stage + ": " + message);
        this.stage = stage;
    }

    public FusionPipelineException(String stage, String message, Throwable cause) {
        super(stage + ": " + message, cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
