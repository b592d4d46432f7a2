package com.reliefx.orchestrator.engine.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Response from POST {analysis-engine}/analyze.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalyzeResponse(String model, List<FindingPayload> findings) {}
