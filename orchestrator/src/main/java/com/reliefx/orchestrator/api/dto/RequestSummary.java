package com.reliefx.orchestrator.api.dto;

import com.reliefx.orchestrator.model.RescueRequest;

import java.time.Instant;

/** One row of GET /requests. */
public record RequestSummary(String requestId, String status, String regionName,
                             String eventName, Instant createdAt) {

    public static RequestSummary from(RescueRequest r) {
        return new RequestSummary(r.getRequestId(), r.getStatus().name(),
                r.getRegionName(), r.getEventName(), r.getCreatedAt());
    }
}
