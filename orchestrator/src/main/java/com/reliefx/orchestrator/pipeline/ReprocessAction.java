package com.reliefx.orchestrator.pipeline;

/** What an operator reprocess did. */
public enum ReprocessAction {
    DAMAGE_REQUEUED,
    LOGISTICS_REQUEUED,
    NOTHING_TO_DO
}
