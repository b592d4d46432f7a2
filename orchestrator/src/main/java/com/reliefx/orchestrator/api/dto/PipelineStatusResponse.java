package com.reliefx.orchestrator.api.dto;

import com.reliefx.orchestrator.model.DamageReport;
import com.reliefx.orchestrator.model.LogisticsPlan;
import com.reliefx.orchestrator.model.RescueRequest;

import java.time.Instant;

/**
 * Response body for GET /requests/{id}: the request plus whatever each stage
 * has written so far. {@code damageReport} and {@code logisticsPlan} are null
 * until their stage claims the request.
 */
public record PipelineStatusResponse(
        String            requestId,
        String            status,
        String            regionName,
        String            eventName,
        boolean           dispatched,
        Instant           createdAt,
        Instant           updatedAt,
        DamageReportView  damageReport,
        LogisticsPlanView logisticsPlan
) {
    public static PipelineStatusResponse from(RescueRequest r, DamageReport report, LogisticsPlan plan) {
        return new PipelineStatusResponse(
                r.getRequestId(),
                r.getStatus().name(),
                r.getRegionName(),
                r.getEventName(),
                r.isDispatched(),
                r.getCreatedAt(),
                r.getUpdatedAt(),
                report == null ? null : DamageReportView.from(report),
                plan   == null ? null : LogisticsPlanView.from(plan)
        );
    }
}
