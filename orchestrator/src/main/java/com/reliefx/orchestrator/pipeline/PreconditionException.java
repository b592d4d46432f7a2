package com.reliefx.orchestrator.pipeline;

/**
 * A stage was triggered before the record it depends on is ready.
 *
 * Thrown out of a stage handler so the Trigger Bus requeues the message with
 * backoff; after the delivery limit the trigger is dead-lettered.
 */
public class PreconditionException extends RuntimeException {

    public PreconditionException(String message) {
        super(message);
    }
}
