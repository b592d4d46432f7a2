package com.reliefx.orchestrator.bus;

import com.reliefx.orchestrator.model.TriggerTopic;

/**
 * A consumer of one bus topic.
 *
 * Returning normally acknowledges the message. Throwing any exception asks the
 * bus to redeliver it later (with backoff, up to the delivery limit).
 * Handlers must be idempotent: the same message can arrive more than once,
 * concurrently, on different instances.
 */
public interface TriggerHandler {

    TriggerTopic topic();

    void handle(TriggerMessage message);
}
