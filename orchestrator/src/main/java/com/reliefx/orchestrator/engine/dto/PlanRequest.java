package com.reliefx.orchestrator.engine.dto;

import java.util.List;
import java.util.Map;

/**
 * Body of POST {planning-engine}/plan.
 */
public record PlanRequest(
        String request_id,
        List<FindingPayload> findings,
        Map<String, Integer> inventory
) {}
