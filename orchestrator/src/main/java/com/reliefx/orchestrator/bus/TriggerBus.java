package com.reliefx.orchestrator.bus;

import com.reliefx.orchestrator.model.TriggerTopic;

import java.util.UUID;

/**
 * At-least-once asynchronous delivery between pipeline stages.
 *
 * No ordering is guaranteed across messages, and a message may be delivered
 * more than once.
 */
public interface TriggerBus {

    /**
     * Durably enqueue a trigger for {@code requestId}.
     *
     * Returns once the message is persisted, not once it is consumed.
     *
     * @return the message id (the enqueue acknowledgment)
     * @throws TriggerPublishException if the message could not be enqueued
     */
    UUID publish(TriggerTopic topic, String requestId);

    /** Register the handler for its topic. One handler per topic. */
    void subscribe(TriggerHandler handler);
}
