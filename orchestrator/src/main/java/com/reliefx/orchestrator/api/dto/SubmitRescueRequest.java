package com.reliefx.orchestrator.api.dto;

import com.reliefx.orchestrator.pipeline.IntakeCommand;

/**
 * Request body for POST /requests.
 *
 * Required: regionName, eventName, preEventImagery, postEventImagery
 * Optional: areaOfInterest (GeoJSON polygon)
 */
public record SubmitRescueRequest(String regionName,
                                  String eventName,
                                  String areaOfInterest,
                                  String preEventImagery,
                                  String postEventImagery) {

    public IntakeCommand toCommand() {
        return new IntakeCommand(regionName, eventName, areaOfInterest, preEventImagery, postEventImagery);
    }
}
