package com.reliefx.orchestrator.engine.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One deployment action as returned by the planning engine.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ActionPayload(String resource_type, Integer quantity, String destination, Integer priority) {}
