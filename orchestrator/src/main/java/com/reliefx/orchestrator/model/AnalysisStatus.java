package com.reliefx.orchestrator.model;

/**
 * Status of a DamageReport.
 *
 * Transitions:
 *   (absent)  → ANALYZING (claimed by exactly one damage worker)
 *   ANALYZING → COMPLETE  (findings written)
 *   ANALYZING → FAILED    (engine error, timeout, invalid output or expired claim)
 *   FAILED    → PENDING   (operator reprocess)
 *   PENDING   → ANALYZING (claimed again)
 */
public enum AnalysisStatus {
    PENDING,
    ANALYZING,
    COMPLETE,
    FAILED
}
