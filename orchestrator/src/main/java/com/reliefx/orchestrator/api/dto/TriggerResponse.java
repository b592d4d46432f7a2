package com.reliefx.orchestrator.api.dto;

import com.reliefx.orchestrator.model.Trigger;
import com.reliefx.orchestrator.model.TriggerState;
import com.reliefx.orchestrator.model.TriggerTopic;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of a trigger row, returned by GET /triggers.
 * {@code lastError} holds the most recent handler failure; for DEAD triggers
 * it is the reason the message was dead-lettered.
 */
public record TriggerResponse(
        UUID         id,
        TriggerTopic topic,
        String       requestId,
        TriggerState state,
        int          deliveryCount,
        Instant      availableAt,
        String       consumer,
        String       lastError,
        Instant      createdAt,
        Instant      ackedAt
) {
    public static TriggerResponse from(Trigger t) {
        return new TriggerResponse(
                t.getId(),
                t.getTopic(),
                t.getRequestId(),
                t.getState(),
                t.getDeliveryCount(),
                t.getAvailableAt(),
                t.getConsumer(),
                t.getLastError(),
                t.getCreatedAt(),
                t.getAckedAt()
        );
    }
}
