package com.reliefx.orchestrator.engine;

/**
 * Thrown when an external analysis engine returns an error, an unreadable
 * response, or is unreachable.
 */
public class EngineException extends RuntimeException {

    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
