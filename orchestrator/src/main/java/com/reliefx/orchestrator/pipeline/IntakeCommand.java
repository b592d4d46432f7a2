package com.reliefx.orchestrator.pipeline;

/**
 * A raw rescue request as submitted at the intake boundary. Not yet validated.
 *
 * @param areaOfInterest optional GeoJSON polygon around the affected area
 */
public record IntakeCommand(
        String regionName,
        String eventName,
        String areaOfInterest,
        String preEventImagery,
        String postEventImagery
) {}
