package com.kmesh.fusion.synthesis;

public class SynthesisUnavailableException extends RuntimeException {
    public SynthesisUnavailableException(String message) {
        super(message);
    }

    public SynthesisUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
