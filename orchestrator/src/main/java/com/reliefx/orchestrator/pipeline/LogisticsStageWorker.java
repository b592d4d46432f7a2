package com.reliefx.orchestrator.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reliefx.orchestrator.config.PipelineProperties;
import com.reliefx.orchestrator.engine.InventorySnapshot;
import com.reliefx.orchestrator.engine.InventorySource;
import com.reliefx.orchestrator.engine.PlanGenerator;
import com.reliefx.orchestrator.engine.PlanResult;
import com.reliefx.orchestrator.model.*;
import com.reliefx.orchestrator.store.StateStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Logistics stage: triggered → planning → (complete | failed).
 *
 * Requires a COMPLETE DamageReport. A report that is missing or still in
 * progress raises {@link PreconditionException}, so the bus requeues the
 * trigger with backoff; no plan row is written until the report is ready.
 */
@Component
public class LogisticsStageWorker extends StageWorker {

    private static final Logger log = LoggerFactory.getLogger(LogisticsStageWorker.class);

    static final String ENGINE = "plan-generation";

    private final StateStore       store;
    private final IdempotencyGuard guard;
    private final PlanGenerator    generator;
    private final InventorySource  inventorySource;
    private final EngineCallRunner calls;
    private final ObjectMapper     objectMapper;
    private final Duration         timeout;

    public LogisticsStageWorker(StateStore store,
                                IdempotencyGuard guard,
                                PlanGenerator generator,
                                InventorySource inventorySource,
                                EngineCallRunner calls,
                                ObjectMapper objectMapper,
                                PipelineProperties properties,
                                MeterRegistry meterRegistry) {
        super(Stage.LOGISTICS, properties.getInstanceId(), meterRegistry);
        this.store           = store;
        this.guard           = guard;
        this.generator       = generator;
        this.inventorySource = inventorySource;
        this.calls           = calls;
        this.objectMapper    = objectMapper;
        this.timeout         = properties.getEngines().getPlanning().getTimeout();
    }

    @Override
    public TriggerTopic topic() {
        return TriggerTopic.LOGISTICS_PLANNING;
    }

    @Override
    protected StageOutcome advance(String requestId) {
        Optional<LogisticsPlan> existing = store.findLogisticsPlan(requestId);
        if (existing.isPresent() && existing.get().getStatus() != PlanStatus.PENDING) {
            log.info("Duplicate logistics trigger for {} ignored (plan is {})",
                    requestId, existing.get().getStatus());
            return StageOutcome.DUPLICATE_DELIVERY;
        }

        DamageReport report = store.findDamageReport(requestId)
                .orElseThrow(() -> new PreconditionException(
                        "Damage report not ready for " + requestId + ": no report"));
        switch (report.getStatus()) {
            case COMPLETE -> { }
            case FAILED -> {
                log.warn("Logistics trigger for {} dropped: damage report FAILED", requestId);
                return StageOutcome.ABANDONED;
            }
            case PENDING, ANALYZING -> throw new PreconditionException(
                    "Damage report not ready for " + requestId + ": " + report.getStatus());
        }

        InventorySnapshot inventory = inventorySource.snapshot();

        String owner = newOwner();
        if (!guard.claim(StageKey.logistics(requestId), owner).acquired()) {
            log.debug("Logistics claim for {} lost to a concurrent worker", requestId);
            return StageOutcome.CLAIM_CONFLICT;
        }
        store.updateRequestStatus(requestId, RequestStatus.PLANNING);

        List<DamageFinding> findings = report.getFindings();
        PlanResult result;
        try {
            result = calls.call(ENGINE, timeout, () -> generator.generate(requestId, findings, inventory));
            validate(result, findings, inventory);
        } catch (ExternalFunctionException e) {
            log.warn("Plan generation failed for {}: {}", requestId, e.getMessage());
            if (!store.failLogisticsPlan(requestId, owner, e.getMessage())) {
                log.warn("Claim on logistics plan {} was lost before the failure could be recorded", requestId);
                return StageOutcome.CLAIM_LOST;
            }
            store.updateRequestStatus(requestId, RequestStatus.FAILED);
            return StageOutcome.FAILED;
        }

        if (!store.completeLogisticsPlan(requestId, owner, result.actions(), result.model(),
                snapshotJson(inventory))) {
            log.warn("Claim on logistics plan {} was lost before completion; result discarded", requestId);
            return StageOutcome.CLAIM_LOST;
        }
        store.updateRequestStatus(requestId, RequestStatus.COMPLETED);
        log.info("Logistics plan {} complete: {} action(s) from {}",
                requestId, result.actions().size(), result.model());
        return StageOutcome.COMPLETED;
    }

    /**
     * A plan must deploy only stock that exists: every action names a known
     * resource type with a positive quantity, and per-type totals stay within
     * the snapshot.
     */
    static void validate(PlanResult result, List<DamageFinding> findings, InventorySnapshot inventory) {
        if (result == null) {
            throw new ExternalFunctionException(ENGINE + " returned no result");
        }
        List<DeploymentAction> actions = result.actions();
        if (actions.isEmpty() && !findings.isEmpty()) {
            throw new ExternalFunctionException("plan has no actions for " + findings.size() + " finding(s)");
        }

        Map<String, Long> totals = new HashMap<>();
        for (int i = 0; i < actions.size(); i++) {
            DeploymentAction a = actions.get(i);
            String type = a.getResourceType();
            if (type == null || !inventory.stock().containsKey(type)) {
                throw new ExternalFunctionException("action " + i + " uses unknown resource type '" + type + "'");
            }
            if (a.getQuantity() <= 0) {
                throw new ExternalFunctionException("action " + i + " has non-positive quantity " + a.getQuantity());
            }
            if (a.getDestination() == null || a.getDestination().isBlank()) {
                throw new ExternalFunctionException("action " + i + " has no destination");
            }
            if (a.getPriority() < 1) {
                throw new ExternalFunctionException("action " + i + " has priority " + a.getPriority() + " below 1");
            }
            totals.merge(type, (long) a.getQuantity(), Long::sum);
        }

        for (Map.Entry<String, Long> e : totals.entrySet()) {
            int available = inventory.available(e.getKey());
            if (e.getValue() > available) {
                throw new ExternalFunctionException("plan allocates " + e.getValue() + " of '" + e.getKey()
                        + "' but only " + available + " available");
            }
        }
    }

    private String snapshotJson(InventorySnapshot inventory) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("takenAt", inventory.takenAt().toString());
        doc.put("stock", inventory.stock());
        try {
            return objectMapper.writeValueAsString(doc);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise inventory snapshot", e);
        }
    }
}
