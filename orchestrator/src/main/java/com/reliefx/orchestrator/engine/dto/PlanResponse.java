package com.reliefx.orchestrator.engine.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Response from POST {planning-engine}/plan.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlanResponse(String model, List<ActionPayload> actions) {}
