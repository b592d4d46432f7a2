package com.reliefx.orchestrator.bus;

import com.reliefx.orchestrator.model.TriggerTopic;

/**
 * Thrown when a trigger could not be durably enqueued.
 */
public class TriggerPublishException extends RuntimeException {

    public TriggerPublishException(TriggerTopic topic, String requestId, Throwable cause) {
        super("Failed to publish " + topic + " trigger for request " + requestId, cause);
    }
}
