package com.reliefx.orchestrator.engine;

import com.reliefx.orchestrator.model.DamageFinding;

import java.util.List;

/**
 * Output of the imagery-analysis engine.
 *
 * @param findings detections in the order the engine reported them
 * @param model    engine-reported model identifier, may be null
 */
public record AnalysisResult(List<DamageFinding> findings, String model) {

    public AnalysisResult {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }
}
