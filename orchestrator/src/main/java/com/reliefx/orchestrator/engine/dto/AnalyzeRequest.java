package com.reliefx.orchestrator.engine.dto;

/**
 * Body of POST {analysis-engine}/analyze.
 */
public record AnalyzeRequest(
        String request_id,
        String region_name,
        String event_name,
        String area_of_interest,
        String pre_event_imagery,
        String post_event_imagery
) {}
