package com.reliefx.orchestrator.model;

/**
 * Delivery state of a single Trigger row.
 *
 * Transitions:
 *   PENDING   → IN_FLIGHT (leased by a consumer)
 *   IN_FLIGHT → ACKED     (handler returned normally)
 *   IN_FLIGHT → PENDING   (handler threw, or the lease expired; delivery_count incremented)
 *   IN_FLIGHT → DEAD      (max deliveries exhausted)
 */
public enum TriggerState {
    PENDING,
    IN_FLIGHT,
    ACKED,
    DEAD
}
