package com.reliefx.orchestrator.engine.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A finding as it travels to and from the engines.
 * Boxed confidence so a missing value can be told apart from 0.0.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FindingPayload(String location, String category, Double confidence) {}
