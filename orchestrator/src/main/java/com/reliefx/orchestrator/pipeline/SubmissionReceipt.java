package com.reliefx.orchestrator.pipeline;

import com.reliefx.orchestrator.model.RequestStatus;

/**
 * Returned by the Intake Router before any downstream stage has run.
 *
 * @param dispatched false when the request was stored but its damage trigger
 *                   could not be published; the dispatch reconciler retries it
 */
public record SubmissionReceipt(String requestId, RequestStatus status, boolean dispatched) {}
