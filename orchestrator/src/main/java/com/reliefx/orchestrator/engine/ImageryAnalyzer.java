package com.reliefx.orchestrator.engine;

import com.reliefx.orchestrator.model.RescueRequest;

/**
 * The external imagery-analysis function. Slow (minutes) and expensive.
 */
public interface ImageryAnalyzer {

    /**
     * Detect damage in the request's pre/post-event imagery.
     *
     * @throws EngineException on any engine-side failure
     */
    AnalysisResult analyze(RescueRequest request);
}
