package com.reliefx.orchestrator.engine;

import com.reliefx.orchestrator.model.DeploymentAction;

import java.util.List;

/**
 * Output of the plan-generation engine.
 *
 * @param actions ordered deployment actions
 * @param model   engine-reported model identifier, may be null
 */
public record PlanResult(List<DeploymentAction> actions, String model) {

    public PlanResult {
        actions = actions == null ? List.of() : List.copyOf(actions);
    }
}
