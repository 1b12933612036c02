package com.kmesh.router.fusion;

public class FusionUnavailableException extends RuntimeException {
    public FusionUnavailableException(String message) {
        super(message);
    }

    public FusionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
