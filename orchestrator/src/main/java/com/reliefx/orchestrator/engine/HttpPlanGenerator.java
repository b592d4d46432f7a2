package com.reliefx.orchestrator.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reliefx.orchestrator.config.PipelineProperties;
import com.reliefx.orchestrator.engine.dto.ActionPayload;
import com.reliefx.orchestrator.engine.dto.FindingPayload;
import com.reliefx.orchestrator.engine.dto.PlanRequest;
import com.reliefx.orchestrator.engine.dto.PlanResponse;
import com.reliefx.orchestrator.model.DamageFinding;
import com.reliefx.orchestrator.model.DeploymentAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Plan-generation engine reached over HTTP.
 *
 * POST {reliefx.engines.planning.base-url}/plan
 */
@Component
public class HttpPlanGenerator implements PlanGenerator {

    private static final Logger log = LoggerFactory.getLogger(HttpPlanGenerator.class);

    private final EngineClient client;
    private final Duration     timeout;

    public HttpPlanGenerator(PipelineProperties properties, ObjectMapper objectMapper) {
        PipelineProperties.Engine engine = properties.getEngines().getPlanning();
        this.client  = new EngineClient("plan-generation", engine.getBaseUrl(), objectMapper);
        this.timeout = engine.getTimeout();
    }

    @Override
    public PlanResult generate(String requestId, List<DamageFinding> findings, InventorySnapshot inventory) {
        log.info("Requesting logistics plan for {} ({} findings, {} resource types)",
                requestId, findings.size(), inventory.stock().size());
        List<FindingPayload> payload = findings.stream()
                .map(f -> new FindingPayload(f.getLocation(), f.getCategory(), f.getConfidence()))
                .toList();
        PlanResponse response = client.post("/plan",
                new PlanRequest(requestId, payload, inventory.stock()),
                PlanResponse.class, timeout);
        return new PlanResult(toActions(response.actions()), response.model());
    }

    static List<DeploymentAction> toActions(List<ActionPayload> payloads) {
        if (payloads == null) {
            throw new EngineException("plan-generation response has no 'actions' field");
        }
        List<DeploymentAction> actions = new ArrayList<>(payloads.size());
        for (ActionPayload p : payloads) {
            if (p == null || p.quantity() == null || p.priority() == null) {
                throw new EngineException("plan-generation returned an action without quantity or priority");
            }
            actions.add(new DeploymentAction(p.resource_type(), p.quantity(), p.destination(), p.priority()));
        }
        return actions;
    }
}
