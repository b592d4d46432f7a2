package com.reliefx.orchestrator.support;

import com.reliefx.orchestrator.config.PipelineProperties;
import com.reliefx.orchestrator.engine.AnalysisResult;
import com.reliefx.orchestrator.engine.InventorySnapshot;
import com.reliefx.orchestrator.engine.PlanResult;
import com.reliefx.orchestrator.model.DamageFinding;
import com.reliefx.orchestrator.model.DeploymentAction;
import com.reliefx.orchestrator.model.RescueRequest;
import com.reliefx.orchestrator.pipeline.IntakeCommand;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Shared test data. */
public final class Fixtures {

    public static final String WATER = "Water Filters (units)";
    public static final String TENTS = "Tents (family size)";

    private Fixtures() {}

    /** Properties with no publish backoff and short engine timeouts. */
    public static PipelineProperties properties() {
        PipelineProperties p = new PipelineProperties();
        p.setInstanceId("test-instance");
        p.getIntake().setPublishBackoff(Duration.ZERO);
        p.getEngines().getAnalysis().setTimeout(Duration.ofSeconds(2));
        p.getEngines().getPlanning().setTimeout(Duration.ofSeconds(2));
        Map<String, Integer> stock = new LinkedHashMap<>();
        stock.put(WATER, 200);
        stock.put(TENTS, 150);
        p.getInventory().setStock(stock);
        return p;
    }

    public static IntakeCommand validCommand() {
        return new IntakeCommand("Valencia", "DANA floods 2024", null,
                "s3://imagery/valencia/pre.tif", "s3://imagery/valencia/post.tif");
    }

    public static RescueRequest request(String requestId) {
        return new RescueRequest(requestId, "Valencia", "DANA floods 2024", null,
                "s3://imagery/valencia/pre.tif", "s3://imagery/valencia/post.tif");
    }

    public static List<DamageFinding> findings() {
        return List.of(
                new DamageFinding("Paiporta", "flooded_building", 0.91),
                new DamageFinding("Alfafar", "blocked_road", 0.74));
    }

    public static AnalysisResult analysis() {
        return new AnalysisResult(findings(), "damage-net-v3");
    }

    public static List<DeploymentAction> actions() {
        return List.of(
                new DeploymentAction(WATER, 120, "Paiporta", 1),
                new DeploymentAction(TENTS, 40, "Alfafar", 2));
    }

    public static PlanResult plan() {
        return new PlanResult(actions(), "planner-v1");
    }

    public static InventorySnapshot inventory() {
        return new InventorySnapshot(properties().getInventory().getStock(), Instant.parse("2024-11-01T10:00:00Z"));
    }
}
