package com.reliefx.orchestrator.pipeline;

/** The two claimable pipeline stages. Intake has no claim. */
public enum Stage {
    DAMAGE,
    LOGISTICS
}
