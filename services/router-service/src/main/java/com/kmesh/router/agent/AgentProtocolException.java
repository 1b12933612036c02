package com.kmesh.router.agent;

/**
 * The agent answered, but its response breaks the recall contract.
 */
public class AgentProtocolException extends RuntimeException {
    public AgentProtocolException(String message) {
        super(message);
    }
}
