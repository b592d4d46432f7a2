package com.reliefx.orchestrator.model;

/**
 * Pipeline progress of a RescueRequest, as seen by the Status Observer.
 *
 * Transitions (happy path):
 *   SUBMITTED → ANALYZING → ASSESSED → PLANNING → COMPLETED
 *
 * ANALYZING and PLANNING can transition to FAILED. An operator reprocess
 * moves FAILED back to SUBMITTED (damage stage) or ASSESSED (logistics stage).
 */
public enum RequestStatus {
    SUBMITTED,
    ANALYZING,
    ASSESSED,
    PLANNING,
    COMPLETED,
    FAILED
}
