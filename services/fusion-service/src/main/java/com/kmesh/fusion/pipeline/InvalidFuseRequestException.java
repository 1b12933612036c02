package com.kmesh.fusion.pipeline;

public class InvalidFuseRequestException extends RuntimeException {
    public InvalidFuseRequestException(String message) {
        super(message);
    }
}
