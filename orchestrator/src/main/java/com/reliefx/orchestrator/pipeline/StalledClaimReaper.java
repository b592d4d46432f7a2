package com.reliefx.orchestrator.pipeline;

import com.reliefx.orchestrator.config.PipelineProperties;
import com.reliefx.orchestrator.model.DamageReport;
import com.reliefx.orchestrator.model.LogisticsPlan;
import com.reliefx.orchestrator.model.RequestStatus;
import com.reliefx.orchestrator.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Fails claims whose worker died mid-stage.
 *
 * A report left ANALYZING (or a plan left PLANNING) absorbs every redelivery
 * as a duplicate, so without this sweep the request would be stuck forever.
 * The fail is owner-checked: a worker that finishes just as its claim is
 * reaped loses the race cleanly in one direction or the other.
 */
@Component
public class StalledClaimReaper {

    private static final Logger log = LoggerFactory.getLogger(StalledClaimReaper.class);

    private final StateStore store;
    private final Duration   staleAfter;
    private final Clock      clock;

    public StalledClaimReaper(StateStore store, PipelineProperties properties) {
        this(store, properties, Clock.systemUTC());
    }

    StalledClaimReaper(StateStore store, PipelineProperties properties, Clock clock) {
        this.store      = store;
        this.staleAfter = properties.getRecovery().getStaleClaimAfter();
        this.clock      = clock;
    }

    /** @return number of claims failed by this sweep */
    @Scheduled(fixedDelayString = "${reliefx.recovery.sweep-interval-ms:60000}")
    public int reapStalledClaims() {
        Instant cutoff = clock.instant().minus(staleAfter);
        int reaped = 0;

        for (DamageReport report : store.findStalledDamageClaims(cutoff)) {
            String id = report.getRequestId();
            if (store.failDamageReport(id, report.getWorkerId(), expiredMessage(report.getWorkerId()))) {
                store.updateRequestStatus(id, RequestStatus.FAILED);
                log.warn("Damage claim on {} by '{}' expired (claimed at {}); marked FAILED",
                        id, report.getWorkerId(), report.getClaimedAt());
                reaped++;
            }
        }

        for (LogisticsPlan plan : store.findStalledPlanningClaims(cutoff)) {
            String id = plan.getRequestId();
            if (store.failLogisticsPlan(id, plan.getWorkerId(), expiredMessage(plan.getWorkerId()))) {
                store.updateRequestStatus(id, RequestStatus.FAILED);
                log.warn("Logistics claim on {} by '{}' expired (claimed at {}); marked FAILED",
                        id, plan.getWorkerId(), plan.getClaimedAt());
                reaped++;
            }
        }
        return reaped;
    }

    private String expiredMessage(String owner) {
        return "Claim expired: '" + owner + "' did not finish within " + staleAfter;
    }
}
