package com.reliefx.orchestrator.store;

import com.reliefx.orchestrator.model.RecordType;

import java.time.Instant;

/**
 * Change notification emitted after a State Store write commits.
 *
 * @param type      collection that changed
 * @param requestId key of the changed record
 * @param status    status of the record after the write
 * @param at        when the write happened
 */
public record RecordChange(RecordType type, String requestId, String status, Instant at) {

    public static RecordChange of(RecordType type, String requestId, Enum<?> status) {
        return new RecordChange(type, requestId, status.name(), Instant.now());
    }
}
