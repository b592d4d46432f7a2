package com.reliefx.orchestrator.bus;

import com.reliefx.orchestrator.model.Trigger;
import com.reliefx.orchestrator.model.TriggerTopic;

import java.util.UUID;

/**
 * What a stage handler receives: the request_id to advance, plus delivery metadata.
 *
 * @param messageId id of the trigger row, stable across redeliveries
 * @param topic     the stage this message is addressed to
 * @param requestId request to advance
 * @param delivery  1 on first delivery, incremented on every redelivery
 */
public record TriggerMessage(UUID messageId, TriggerTopic topic, String requestId, int delivery) {

    public static TriggerMessage from(Trigger trigger) {
        return new TriggerMessage(trigger.getId(), trigger.getTopic(),
                trigger.getRequestId(), trigger.getDeliveryCount());
    }

    public boolean isRedelivery() {
        return delivery > 1;
    }
}
