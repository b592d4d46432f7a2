package com.reliefx.orchestrator.pipeline;

/**
 * The analysis or planning engine failed, timed out, or returned output that
 * does not satisfy the record's constraints.
 *
 * Never propagated past the stage worker: it is recorded as FAILED on the
 * owning record, and the message is acknowledged.
 */
public class ExternalFunctionException extends RuntimeException {

    public ExternalFunctionException(String message) {
        super(message);
    }

    public ExternalFunctionException(String message, Throwable cause) {
        super(message, cause);
    }
}
