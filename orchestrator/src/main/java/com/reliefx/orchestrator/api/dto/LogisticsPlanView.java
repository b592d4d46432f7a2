package com.reliefx.orchestrator.api.dto;

import com.reliefx.orchestrator.model.LogisticsPlan;
import com.reliefx.orchestrator.model.PlanStatus;

import java.time.Instant;
import java.util.List;

public record LogisticsPlanView(
        PlanStatus        status,
        List<ActionView>  actions,
        String            planningModel,
        String            inventorySnapshot,
        String            errorSummary,
        String            workerId,
        int               attempt,
        Instant           claimedAt,
        Instant           completedAt
) {
    public record ActionView(String resourceType, int quantity, String destination, int priority) {}

    public static LogisticsPlanView from(LogisticsPlan p) {
        return new LogisticsPlanView(
                p.getStatus(),
                p.getActions().stream()
                        .map(a -> new ActionView(a.getResourceType(), a.getQuantity(),
                                a.getDestination(), a.getPriority()))
                        .toList(),
                p.getPlanningModel(),
                p.getInventorySnapshot(),
                p.getErrorSummary(),
                p.getWorkerId(),
                p.getAttempt(),
                p.getClaimedAt(),
                p.getCompletedAt()
        );
    }
}
