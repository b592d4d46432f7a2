package com.reliefx.orchestrator.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reliefx.orchestrator.config.PipelineProperties;
import com.reliefx.orchestrator.engine.dto.AnalyzeRequest;
import com.reliefx.orchestrator.engine.dto.AnalyzeResponse;
import com.reliefx.orchestrator.engine.dto.FindingPayload;
import com.reliefx.orchestrator.model.DamageFinding;
import com.reliefx.orchestrator.model.RescueRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Imagery-analysis engine reached over HTTP.
 *
 * POST {reliefx.engines.analysis.base-url}/analyze
 */
@Component
public class HttpImageryAnalyzer implements ImageryAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(HttpImageryAnalyzer.class);

    private final EngineClient client;
    private final Duration     timeout;

    public HttpImageryAnalyzer(PipelineProperties properties, ObjectMapper objectMapper) {
        PipelineProperties.Engine engine = properties.getEngines().getAnalysis();
        this.client  = new EngineClient("imagery-analysis", engine.getBaseUrl(), objectMapper);
        this.timeout = engine.getTimeout();
    }

    @Override
    public AnalysisResult analyze(RescueRequest request) {
        log.info("Requesting damage analysis for {} ({} / {})",
                request.getRequestId(), request.getEventName(), request.getRegionName());
        AnalyzeResponse response = client.post("/analyze", new AnalyzeRequest(
                        request.getRequestId(),
                        request.getRegionName(),
                        request.getEventName(),
                        request.getAreaOfInterest(),
                        request.getPreEventImagery(),
                        request.getPostEventImagery()),
                AnalyzeResponse.class, timeout);
        return new AnalysisResult(toFindings(response.findings()), response.model());
    }

    static List<DamageFinding> toFindings(List<FindingPayload> payloads) {
        if (payloads == null) {
            throw new EngineException("imagery-analysis response has no 'findings' field");
        }
        List<DamageFinding> findings = new ArrayList<>(payloads.size());
        for (FindingPayload p : payloads) {
            if (p == null || p.confidence() == null) {
                throw new EngineException("imagery-analysis returned a finding without confidence");
            }
            findings.add(new DamageFinding(p.location(), p.category(), p.confidence()));
        }
        return findings;
    }
}
