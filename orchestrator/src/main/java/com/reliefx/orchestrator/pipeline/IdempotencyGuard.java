package com.reliefx.orchestrator.pipeline;

import com.reliefx.orchestrator.store.ClaimResult;
import com.reliefx.orchestrator.store.StateStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * claim(key) → {ACQUIRED, ALREADY_OWNED_OR_DONE}, shared by both stage workers.
 *
 * Delegates to the State Store's conditional create, so at most one worker
 * instance proceeds past the claim for a given key, whatever the number of
 * concurrent deliveries or instances.
 */
@Component
public class IdempotencyGuard {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyGuard.class);

    private final StateStore    store;
    private final MeterRegistry meterRegistry;

    public IdempotencyGuard(StateStore store, MeterRegistry meterRegistry) {
        this.store         = store;
        this.meterRegistry = meterRegistry;
    }

    public ClaimResult claim(StageKey key, String owner) {
        ClaimResult result = switch (key.stage()) {
            case DAMAGE    -> store.claimDamageReport(key.requestId(), owner);
            case LOGISTICS -> store.claimLogisticsPlan(key.requestId(), owner);
        };
        meterRegistry.counter("reliefx.claims",
                "stage", key.stage().name(), "result", result.name()).increment();
        if (result.acquired()) {
            log.info("Claim {} acquired by '{}'", key, owner);
        } else {
            log.debug("Claim {} not acquired by '{}': already owned or done", key, owner);
        }
        return result;
    }
}
