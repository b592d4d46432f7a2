package com.reliefx.orchestrator.pipeline;

import com.reliefx.orchestrator.bus.TriggerBus;
import com.reliefx.orchestrator.bus.TriggerPublishException;
import com.reliefx.orchestrator.config.PipelineProperties;
import com.reliefx.orchestrator.model.RescueRequest;
import com.reliefx.orchestrator.model.TriggerTopic;
import com.reliefx.orchestrator.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Re-publishes the damage trigger for requests the Intake Router stored but
 * could not dispatch. A duplicate publish is absorbed by the damage worker's claim.
 */
@Component
public class DispatchReconciler {

    private static final Logger log = LoggerFactory.getLogger(DispatchReconciler.class);

    private final StateStore store;
    private final TriggerBus bus;
    private final Duration   grace;
    private final Clock      clock;

    public DispatchReconciler(StateStore store, TriggerBus bus, PipelineProperties properties) {
        this(store, bus, properties, Clock.systemUTC());
    }

    DispatchReconciler(StateStore store, TriggerBus bus, PipelineProperties properties, Clock clock) {
        this.store = store;
        this.bus   = bus;
        this.grace = properties.getRecovery().getUndispatchedAfter();
        this.clock = clock;
    }

    /** @return number of requests dispatched by this sweep */
    @Scheduled(fixedDelayString = "${reliefx.recovery.sweep-interval-ms:60000}")
    public int redispatch() {
        Instant cutoff = clock.instant().minus(grace);
        int dispatched = 0;
        for (RescueRequest request : store.findUndispatchedRequests(cutoff)) {
            String id = request.getRequestId();
            try {
                bus.publish(TriggerTopic.DAMAGE_ANALYSIS, id);
            } catch (TriggerPublishException e) {
                // Still undispatched; the next sweep tries again.
                log.error("Request {} still undispatched: {}", id, e.getMessage());
                continue;
            }
            store.markRequestDispatched(id);
            log.warn("Re-published damage trigger for undispatched request {} (created {})",
                    id, request.getCreatedAt());
            dispatched++;
        }
        return dispatched;
    }
}
