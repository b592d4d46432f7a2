package com.reliefx.orchestrator.store;

/**
 * Thrown when an operation names a request_id that has no Request record.
 */
public class UnknownRequestException extends RuntimeException {

    private final String requestId;

    public UnknownRequestException(String requestId) {
        super("Unknown request: " + requestId);
        this.requestId = requestId;
    }

    public String getRequestId() { return requestId; }
}
