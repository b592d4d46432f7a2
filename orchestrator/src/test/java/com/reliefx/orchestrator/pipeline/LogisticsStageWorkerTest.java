package com.reliefx.orchestrator.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reliefx.orchestrator.config.PipelineProperties;
import com.reliefx.orchestrator.engine.EngineException;
import com.reliefx.orchestrator.engine.PlanGenerator;
import com.reliefx.orchestrator.engine.PlanResult;
import com.reliefx.orchestrator.model.*;
import com.reliefx.orchestrator.support.Fixtures;
import com.reliefx.orchestrator.support.InMemoryStateStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * LogisticsStageWorker against the in-memory store, with a scripted plan generator.
 */
class LogisticsStageWorkerTest {

    static final String ID = "0192d3a4-0000-7000-8000-000000000002";

    InMemoryStateStore   store;
    PipelineProperties   properties;
    ObjectMapper         objectMapper = new ObjectMapper();
    AtomicInteger        engineCalls  = new AtomicInteger();
    PlanGenerator        generator;
    LogisticsStageWorker worker;

    @BeforeEach
    void setUp() {
        store      = new InMemoryStateStore();
        properties = Fixtures.properties();
        store.createRequest(Fixtures.request(ID));
        usePlan(Fixtures.plan());
    }

    private void usePlan(PlanResult result) {
        generator = (requestId, findings, inventory) -> {
            engineCalls.incrementAndGet();
            return result;
        };
        worker = newWorker();
    }

    private LogisticsStageWorker newWorker() {
        SimpleMeterRegistry meters = new SimpleMeterRegistry();
        return new LogisticsStageWorker(store, new IdempotencyGuard(store, meters), generator,
                Fixtures::inventory, new EngineCallRunner(meters), objectMapper, properties, meters);
    }

    private void completeDamageReport() {
        store.claimDamageReport(ID, "damage-owner");
        store.completeDamageReport(ID, "damage-owner", Fixtures.findings(), "damage-net-v3");
        store.updateRequestStatus(ID, RequestStatus.ASSESSED);
    }

    // ------------------------------------------------------------------
    // Happy path
    // ------------------------------------------------------------------

    @Test
    void process_completeReport_writesPlanWithInventorySnapshot() throws Exception {
        completeDamageReport();

        assertThat(worker.process(ID)).isEqualTo(StageOutcome.COMPLETED);

        LogisticsPlan plan = store.findLogisticsPlan(ID).orElseThrow();
        assertThat(plan.getStatus()).isEqualTo(PlanStatus.COMPLETE);
        assertThat(plan.getActions()).containsExactlyElementsOf(Fixtures.actions());
        assertThat(plan.getPlanningModel()).isEqualTo("planner-v1");

        JsonNode snapshot = objectMapper.readTree(plan.getInventorySnapshot());
        assertThat(snapshot.get("stock").get(Fixtures.WATER).asInt()).isEqualTo(200);
        assertThat(snapshot.get("takenAt").asText()).isEqualTo("2024-11-01T10:00:00Z");

        assertThat(store.findRequest(ID).orElseThrow().getStatus()).isEqualTo(RequestStatus.COMPLETED);
        assertThat(store.statusHistory(ID)).containsSubsequence(
                RequestStatus.ASSESSED, RequestStatus.PLANNING, RequestStatus.COMPLETED);
    }

    @Test
    void process_secondDelivery_duplicateNoEngineCall() {
        completeDamageReport();
        worker.process(ID);

        assertThat(worker.process(ID)).isEqualTo(StageOutcome.DUPLICATE_DELIVERY);
        assertThat(engineCalls).hasValue(1);
    }

    // ------------------------------------------------------------------
    // Preconditions
    // ------------------------------------------------------------------

    @Test
    void process_noDamageReport_preconditionAndNoPlanRow() {
        assertThatThrownBy(() -> worker.process(ID))
                .isInstanceOf(PreconditionException.class)
                .hasMessageContaining("not ready");

        assertThat(store.findLogisticsPlan(ID)).isEmpty();
        assertThat(engineCalls).hasValue(0);
    }

    @Test
    void process_damageStillAnalyzing_preconditionAndNoPlanRow() {
        store.claimDamageReport(ID, "damage-owner");

        assertThatThrownBy(() -> worker.process(ID))
                .isInstanceOf(PreconditionException.class)
                .hasMessageContaining("ANALYZING");

        assertThat(store.findLogisticsPlan(ID)).isEmpty();
    }

    @Test
    void process_damageFailed_abandonedWithoutPlan() {
        store.claimDamageReport(ID, "damage-owner");
        store.failDamageReport(ID, "damage-owner", "boom");

        assertThat(worker.process(ID)).isEqualTo(StageOutcome.ABANDONED);

        assertThat(store.findLogisticsPlan(ID)).isEmpty();
        assertThat(engineCalls).hasValue(0);
    }

    // ------------------------------------------------------------------
    // Engine failure and plan validation
    // ------------------------------------------------------------------

    @Test
    void process_engineError_planFailedRequestFailed() {
        completeDamageReport();
        generator = (requestId, findings, inventory) -> { throw new EngineException("HTTP 500"); };
        worker = newWorker();

        assertThat(worker.process(ID)).isEqualTo(StageOutcome.FAILED);

        LogisticsPlan plan = store.findLogisticsPlan(ID).orElseThrow();
        assertThat(plan.getStatus()).isEqualTo(PlanStatus.FAILED);
        assertThat(plan.getErrorSummary()).contains("HTTP 500");
        assertThat(store.findRequest(ID).orElseThrow().getStatus()).isEqualTo(RequestStatus.FAILED);
    }

    @Test
    void process_planExceedsStock_rejected() {
        completeDamageReport();
        usePlan(new PlanResult(List.of(
                new DeploymentAction(Fixtures.TENTS, 100, "Paiporta", 1),
                new DeploymentAction(Fixtures.TENTS, 60, "Alfafar", 2)), "planner-v1"));

        assertThat(worker.process(ID)).isEqualTo(StageOutcome.FAILED);

        assertThat(store.findLogisticsPlan(ID).orElseThrow().getErrorSummary())
                .isEqualTo("plan allocates 160 of 'Tents (family size)' but only 150 available");
    }

    @Test
    void validate_unknownResourceType_rejected() {
        PlanResult plan = new PlanResult(List.of(new DeploymentAction("Helicopters", 1, "Paiporta", 1)), "m");

        assertThatThrownBy(() -> LogisticsStageWorker.validate(plan, Fixtures.findings(), Fixtures.inventory()))
                .isInstanceOf(ExternalFunctionException.class)
                .hasMessageContaining("unknown resource type 'Helicopters'");
    }

    @Test
    void validate_quantitiesWhoseSumExceedsIntRange_stillRejected() {
        PlanResult plan = new PlanResult(List.of(
                new DeploymentAction(Fixtures.WATER, 2_000_000_000, "Paiporta", 1),
                new DeploymentAction(Fixtures.WATER, 2_000_000_000, "Alfafar", 1)), "m");

        assertThatThrownBy(() -> LogisticsStageWorker.validate(plan, Fixtures.findings(), Fixtures.inventory()))
                .isInstanceOf(ExternalFunctionException.class)
                .hasMessage("plan allocates 4000000000 of 'Water Filters (units)' but only 200 available");
    }

    @Test
    void validate_nonPositiveQuantityOrPriority_rejected() {
        PlanResult zeroQty = new PlanResult(List.of(new DeploymentAction(Fixtures.WATER, 0, "Paiporta", 1)), "m");
        PlanResult badPrio = new PlanResult(List.of(new DeploymentAction(Fixtures.WATER, 5, "Paiporta", 0)), "m");

        assertThatThrownBy(() -> LogisticsStageWorker.validate(zeroQty, Fixtures.findings(), Fixtures.inventory()))
                .hasMessageContaining("non-positive quantity");
        assertThatThrownBy(() -> LogisticsStageWorker.validate(badPrio, Fixtures.findings(), Fixtures.inventory()))
                .hasMessageContaining("priority 0");
    }

    @Test
    void validate_emptyPlan_onlyAcceptedWhenThereIsNoDamage() {
        PlanResult empty = new PlanResult(List.of(), "m");

        assertThatThrownBy(() -> LogisticsStageWorker.validate(empty, Fixtures.findings(), Fixtures.inventory()))
                .hasMessageContaining("no actions");
        LogisticsStageWorker.validate(empty, List.of(), Fixtures.inventory());
    }
}
