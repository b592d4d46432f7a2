package com.reliefx.orchestrator.engine;

import com.reliefx.orchestrator.model.DamageFinding;

import java.util.List;

/**
 * The external plan-generation function.
 */
public interface PlanGenerator {

    /**
     * Produce an ordered deployment plan for the findings, using at most the
     * stock in {@code inventory}.
     *
     * @throws EngineException on any engine-side failure
     */
    PlanResult generate(String requestId, List<DamageFinding> findings, InventorySnapshot inventory);
}
