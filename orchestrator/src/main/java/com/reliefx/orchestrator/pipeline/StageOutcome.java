package com.reliefx.orchestrator.pipeline;

/**
 * How a stage worker disposed of one trigger delivery.
 *
 * Every outcome acknowledges the message; only exceptions cause redelivery.
 */
public enum StageOutcome {
    COMPLETED,            // record written as COMPLETE (and downstream triggered)
    FAILED,               // engine failure recorded as FAILED
    DUPLICATE_DELIVERY,   // record already claimed or finished: redelivery absorbed
    CLAIM_CONFLICT,       // lost the conditional create to a concurrent worker
    CLAIM_LOST,           // our claim was expired by the reaper before we finished
    ABANDONED             // dependency failed terminally; nothing to do
}
