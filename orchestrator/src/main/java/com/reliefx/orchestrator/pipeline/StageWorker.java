package com.reliefx.orchestrator.pipeline;

import com.reliefx.orchestrator.bus.TriggerHandler;
import com.reliefx.orchestrator.bus.TriggerMessage;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Common shell of the two claimable stages: logging context, outcome metrics
 * and claim-owner tokens. Subclasses implement {@link #advance(String)}.
 *
 * An exception escaping {@code advance} reaches the bus and causes a redelivery.
 */
public abstract class StageWorker implements TriggerHandler {

    private final Stage         stage;
    private final String        instanceId;
    private final MeterRegistry meterRegistry;

    protected StageWorker(Stage stage, String instanceId, MeterRegistry meterRegistry) {
        this.stage         = stage;
        this.instanceId    = instanceId;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void handle(TriggerMessage message) {
        process(message.requestId());
    }

    public StageOutcome process(String requestId) {
        MDC.put("stage", stage.name());
        MDC.put("requestId", requestId);
        try {
            StageOutcome outcome = advance(requestId);
            meterRegistry.counter("reliefx.stage.outcomes",
                    "stage", stage.name(), "outcome", outcome.name()).increment();
            return outcome;
        } finally {
            MDC.remove("stage");
            MDC.remove("requestId");
        }
    }

    protected abstract StageOutcome advance(String requestId);

    /** A fresh owner per claim attempt, so two deliveries on one instance never share a claim. */
    protected String newOwner() {
        return instanceId + "/" + UUID.randomUUID().toString().substring(0, 8);
    }

    protected Stage stage() {
        return stage;
    }
}
