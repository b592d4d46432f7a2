package com.reliefx.orchestrator.pipeline;

import com.reliefx.orchestrator.bus.TriggerBus;
import com.reliefx.orchestrator.model.*;
import com.reliefx.orchestrator.store.StateStore;
import com.reliefx.orchestrator.store.UnknownRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Operator-triggered reprocessing of a request that failed or stalled.
 *
 * Resets the first FAILED stage to PENDING and publishes its trigger again.
 * The reset record keeps its history (attempt count, previous error summary)
 * until the next claim overwrites the outcome.
 */
@Service
public class ReprocessService {

    private static final Logger log = LoggerFactory.getLogger(ReprocessService.class);

    private final StateStore store;
    private final TriggerBus bus;

    public ReprocessService(StateStore store, TriggerBus bus) {
        this.store = store;
        this.bus   = bus;
    }

    /**
     * @throws UnknownRequestException if no request has this id
     */
    public ReprocessAction reprocess(String requestId) {
        store.findRequest(requestId).orElseThrow(() -> new UnknownRequestException(requestId));

        Optional<DamageReport> report = store.findDamageReport(requestId);
        if (report.isEmpty()) {
            return requeueDamage(requestId);
        }

        switch (report.get().getStatus()) {
            case FAILED:
                if (!store.resetFailedDamageReport(requestId)) {
                    return nothingToDo(requestId, "damage report changed concurrently");
                }
                store.updateRequestStatus(requestId, RequestStatus.SUBMITTED);
                return requeueDamage(requestId);
            case PENDING:
                // Reset earlier but the publish never happened.
                return requeueDamage(requestId);
            case ANALYZING:
                return nothingToDo(requestId, "damage analysis in progress");
            case COMPLETE:
            default:
                break;
        }

        Optional<LogisticsPlan> plan = store.findLogisticsPlan(requestId);
        if (plan.isEmpty()) {
            return requeueLogistics(requestId);
        }
        switch (plan.get().getStatus()) {
            case FAILED:
                if (!store.resetFailedLogisticsPlan(requestId)) {
                    return nothingToDo(requestId, "logistics plan changed concurrently");
                }
                store.updateRequestStatus(requestId, RequestStatus.ASSESSED);
                return requeueLogistics(requestId);
            case PENDING:
                return requeueLogistics(requestId);
            default:
                return nothingToDo(requestId, "logistics plan is " + plan.get().getStatus());
        }
    }

    private ReprocessAction requeueDamage(String requestId) {
        bus.publish(TriggerTopic.DAMAGE_ANALYSIS, requestId);
        store.markRequestDispatched(requestId);
        log.info("Reprocess: damage trigger re-published for {}", requestId);
        return ReprocessAction.DAMAGE_REQUEUED;
    }

    private ReprocessAction requeueLogistics(String requestId) {
        bus.publish(TriggerTopic.LOGISTICS_PLANNING, requestId);
        store.markLogisticsHandoff(requestId);
        log.info("Reprocess: logistics trigger re-published for {}", requestId);
        return ReprocessAction.LOGISTICS_REQUEUED;
    }

    private ReprocessAction nothingToDo(String requestId, String reason) {
        log.info("Reprocess of {} skipped: {}", requestId, reason);
        return ReprocessAction.NOTHING_TO_DO;
    }
}
