package com.reliefx.orchestrator.model;

/**
 * Status of a LogisticsPlan. Mirrors {@link AnalysisStatus} with PLANNING as the claim state.
 */
public enum PlanStatus {
    PENDING,
    PLANNING,
    COMPLETE,
    FAILED
}
