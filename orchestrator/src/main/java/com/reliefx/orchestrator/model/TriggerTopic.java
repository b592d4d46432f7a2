package com.reliefx.orchestrator.model;

/**
 * Topics of the Trigger Bus. One topic per downstream stage.
 */
public enum TriggerTopic {
    DAMAGE_ANALYSIS,     // published by the Intake Router
    LOGISTICS_PLANNING   // published by the Damage Stage Worker
}
