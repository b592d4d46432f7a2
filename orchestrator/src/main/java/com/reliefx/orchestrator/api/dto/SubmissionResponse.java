package com.reliefx.orchestrator.api.dto;

import com.reliefx.orchestrator.pipeline.SubmissionReceipt;

/**
 * Response body for POST /requests. {@code dispatched=false} means the request
 * is stored and will be picked up by the dispatch reconciler.
 */
public record SubmissionResponse(String requestId, String status, boolean dispatched) {

    public static SubmissionResponse from(SubmissionReceipt receipt) {
        return new SubmissionResponse(receipt.requestId(), receipt.status().name(), receipt.dispatched());
    }
}
