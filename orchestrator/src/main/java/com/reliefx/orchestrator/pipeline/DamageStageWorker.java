package com.reliefx.orchestrator.pipeline;

import com.reliefx.orchestrator.bus.TriggerBus;
import com.reliefx.orchestrator.config.PipelineProperties;
import com.reliefx.orchestrator.engine.AnalysisResult;
import com.reliefx.orchestrator.engine.ImageryAnalyzer;
import com.reliefx.orchestrator.model.*;
import com.reliefx.orchestrator.store.StateStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Damage-analysis stage: triggered → analyzing → (complete | failed).
 *
 * Claims the request's DamageReport, runs imagery analysis with a deadline,
 * and on success hands the request off to the logistics stage.
 * Engine failures are recorded on the report; there is no in-worker retry.
 */
@Component
public class DamageStageWorker extends StageWorker {

    private static final Logger log = LoggerFactory.getLogger(DamageStageWorker.class);

    static final String ENGINE = "imagery-analysis";

    private final StateStore       store;
    private final TriggerBus       bus;
    private final IdempotencyGuard guard;
    private final ImageryAnalyzer  analyzer;
    private final EngineCallRunner calls;
    private final Duration         timeout;

    public DamageStageWorker(StateStore store,
                             TriggerBus bus,
                             IdempotencyGuard guard,
                             ImageryAnalyzer analyzer,
                             EngineCallRunner calls,
                             PipelineProperties properties,
                             MeterRegistry meterRegistry) {
        super(Stage.DAMAGE, properties.getInstanceId(), meterRegistry);
        this.store    = store;
        this.bus      = bus;
        this.guard    = guard;
        this.analyzer = analyzer;
        this.calls    = calls;
        this.timeout  = properties.getEngines().getAnalysis().getTimeout();
    }

    @Override
    public TriggerTopic topic() {
        return TriggerTopic.DAMAGE_ANALYSIS;
    }

    @Override
    protected StageOutcome advance(String requestId) {
        Optional<DamageReport> existing = store.findDamageReport(requestId);
        if (existing.isPresent() && existing.get().getStatus() != AnalysisStatus.PENDING) {
            DamageReport report = existing.get();
            if (report.getStatus() == AnalysisStatus.COMPLETE && report.getHandoffAt() == null) {
                log.info("Damage report {} is complete but was never handed off; re-publishing logistics trigger",
                        requestId);
                handOff(requestId);
            } else {
                log.info("Duplicate damage trigger for {} ignored (report is {})", requestId, report.getStatus());
            }
            return StageOutcome.DUPLICATE_DELIVERY;
        }

        RescueRequest request = store.findRequest(requestId)
                .orElseThrow(() -> new PreconditionException("Request " + requestId + " not found"));

        String owner = newOwner();
        if (!guard.claim(StageKey.damage(requestId), owner).acquired()) {
            log.debug("Damage claim for {} lost to a concurrent worker", requestId);
            return StageOutcome.CLAIM_CONFLICT;
        }
        store.updateRequestStatus(requestId, RequestStatus.ANALYZING);

        AnalysisResult result;
        try {
            result = calls.call(ENGINE, timeout, () -> analyzer.analyze(request));
            validate(result);
        } catch (ExternalFunctionException e) {
            log.warn("Damage analysis failed for {}: {}", requestId, e.getMessage());
            if (!store.failDamageReport(requestId, owner, e.getMessage())) {
                log.warn("Claim on damage report {} was lost before the failure could be recorded", requestId);
                return StageOutcome.CLAIM_LOST;
            }
            store.updateRequestStatus(requestId, RequestStatus.FAILED);
            return StageOutcome.FAILED;
        }

        if (!store.completeDamageReport(requestId, owner, result.findings(), result.model())) {
            log.warn("Claim on damage report {} was lost before completion; result discarded", requestId);
            return StageOutcome.CLAIM_LOST;
        }
        store.updateRequestStatus(requestId, RequestStatus.ASSESSED);
        log.info("Damage report {} complete: {} finding(s) from {}",
                requestId, result.findings().size(), result.model());

        handOff(requestId);
        return StageOutcome.COMPLETED;
    }

    // A publish failure propagates: the bus redelivers and the first branch of
    // advance() re-publishes.
    private void handOff(String requestId) {
        bus.publish(TriggerTopic.LOGISTICS_PLANNING, requestId);
        store.markLogisticsHandoff(requestId);
    }

    static void validate(AnalysisResult result) {
        if (result == null) {
            throw new ExternalFunctionException(ENGINE + " returned no result");
        }
        List<DamageFinding> findings = result.findings();
        for (int i = 0; i < findings.size(); i++) {
            DamageFinding f = findings.get(i);
            if (f.getLocation() == null || f.getLocation().isBlank()) {
                throw new ExternalFunctionException("finding " + i + " has no location");
            }
            if (f.getCategory() == null || f.getCategory().isBlank()) {
                throw new ExternalFunctionException("finding " + i + " has no category");
            }
            if (!(f.getConfidence() >= 0.0 && f.getConfidence() <= 1.0)) {
                throw new ExternalFunctionException(
                        "finding " + i + " has confidence " + f.getConfidence() + " outside [0, 1]");
            }
        }
    }
}
