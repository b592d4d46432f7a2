package com.reliefx.orchestrator.store;

/**
 * Outcome of a conditional create on the State Store.
 */
public enum ClaimResult {
    ACQUIRED,               // this caller created (or re-claimed) the record and may proceed
    ALREADY_OWNED_OR_DONE;  // another worker holds the claim, or the stage already finished

    public boolean acquired() {
        return this == ACQUIRED;
    }
}
