package com.reliefx.orchestrator.store;

import com.reliefx.orchestrator.model.*;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * The shared, durable coordination surface of the pipeline.
 *
 * Holds three collections keyed by request_id: requests, damage reports and
 * logistics plans. Stage workers never talk to each other; they only read and
 * conditionally write here and publish triggers on the bus.
 *
 * Every transition on a report or plan after its claim is owner-checked:
 * the {@code owner} argument must match the worker that won the claim,
 * otherwise the call returns {@code false} and changes nothing.
 */
public interface StateStore {

    // ------------------------------------------------------------------
    // Requests
    // ------------------------------------------------------------------

    RescueRequest createRequest(RescueRequest request);

    Optional<RescueRequest> findRequest(String requestId);

    /** Newest first, at most 100; {@code status == null} lists every status. */
    List<RescueRequest> listRequests(RequestStatus status);

    /** Requests written before {@code cutoff} whose damage trigger was never published. */
    List<RescueRequest> findUndispatchedRequests(Instant cutoff);

    /** @throws UnknownRequestException if the request does not exist */
    void updateRequestStatus(String requestId, RequestStatus status);

    /** Record that the damage trigger is enqueued. Idempotent. */
    void markRequestDispatched(String requestId);

    // ------------------------------------------------------------------
    // Damage reports
    // ------------------------------------------------------------------

    /**
     * Conditional create of an ANALYZING report, or PENDING → ANALYZING after a reset.
     * At most one concurrent caller per request_id gets {@link ClaimResult#ACQUIRED}.
     */
    ClaimResult claimDamageReport(String requestId, String owner);

    Optional<DamageReport> findDamageReport(String requestId);

    boolean completeDamageReport(String requestId, String owner,
                                 List<DamageFinding> findings, String analysisModel);

    boolean failDamageReport(String requestId, String owner, String errorSummary);

    /** Record that the logistics trigger for this report is enqueued. */
    void markLogisticsHandoff(String requestId);

    /** Operator reprocess: FAILED → PENDING. Returns false in any other status. */
    boolean resetFailedDamageReport(String requestId);

    List<DamageReport> findStalledDamageClaims(Instant claimedBefore);

    // ------------------------------------------------------------------
    // Logistics plans
    // ------------------------------------------------------------------

    /**
     * Conditional create of a PLANNING plan. Succeeds only while the request's
     * damage report is COMPLETE and no plan exists (or the plan is PENDING).
     */
    ClaimResult claimLogisticsPlan(String requestId, String owner);

    Optional<LogisticsPlan> findLogisticsPlan(String requestId);

    boolean completeLogisticsPlan(String requestId, String owner, List<DeploymentAction> actions,
                                  String planningModel, String inventorySnapshot);

    boolean failLogisticsPlan(String requestId, String owner, String errorSummary);

    boolean resetFailedLogisticsPlan(String requestId);

    List<LogisticsPlan> findStalledPlanningClaims(Instant claimedBefore);

    // ------------------------------------------------------------------
    // Change notifications
    // ------------------------------------------------------------------

    /**
     * Receive a {@link RecordChange} after every committed write to the given collection.
     * Listeners run on the writing thread and must not block.
     */
    Subscription subscribe(RecordType type, Consumer<RecordChange> listener);
}
