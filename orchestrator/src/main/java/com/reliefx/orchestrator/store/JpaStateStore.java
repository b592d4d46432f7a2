package com.reliefx.orchestrator.store;

import com.reliefx.orchestrator.model.*;
import com.reliefx.orchestrator.repository.DamageReportRepository;
import com.reliefx.orchestrator.repository.LogisticsPlanRepository;
import com.reliefx.orchestrator.repository.RescueRequestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * PostgreSQL-backed State Store.
 *
 * All public methods are @Transactional. Each one is a single store round trip
 * from the caller's point of view; callers (the stage workers) are deliberately
 * NOT transactional, so a claim commits before the slow engine call starts.
 */
@Service
public class JpaStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(JpaStateStore.class);

    private final RescueRequestRepository  requestRepo;
    private final DamageReportRepository   reportRepo;
    private final LogisticsPlanRepository  planRepo;
    private final ApplicationEventPublisher events;
    private final ChangeFeed               changeFeed;

    public JpaStateStore(RescueRequestRepository requestRepo,
                         DamageReportRepository reportRepo,
                         LogisticsPlanRepository planRepo,
                         ApplicationEventPublisher events,
                         ChangeFeed changeFeed) {
        this.requestRepo = requestRepo;
        this.reportRepo  = reportRepo;
        this.planRepo    = planRepo;
        this.events      = events;
        this.changeFeed  = changeFeed;
    }

    // ------------------------------------------------------------------
    // Requests
    // ------------------------------------------------------------------

    @Override
    @Transactional
    public RescueRequest createRequest(RescueRequest request) {
        if (requestRepo.existsById(request.getRequestId())) {
            throw new IllegalStateException("Request already exists: " + request.getRequestId());
        }
        RescueRequest saved = requestRepo.save(request);
        notify(RecordChange.of(RecordType.REQUEST, saved.getRequestId(), saved.getStatus()));
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<RescueRequest> findRequest(String requestId) {
        return requestRepo.findById(requestId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<RescueRequest> listRequests(RequestStatus status) {
        return status == null
                ? requestRepo.findTop100ByOrderByCreatedAtDesc()
                : requestRepo.findTop100ByStatusOrderByCreatedAtDesc(status);
    }

    @Override
    @Transactional(readOnly = true)
    public List<RescueRequest> findUndispatchedRequests(Instant cutoff) {
        return requestRepo.findByDispatchedAtIsNullAndCreatedAtBefore(cutoff);
    }

    @Override
    @Transactional
    public void updateRequestStatus(String requestId, RequestStatus status) {
        RescueRequest request = requestRepo.findById(requestId)
                .orElseThrow(() -> new UnknownRequestException(requestId));
        if (request.getStatus() == status) return;
        log.debug("Request {} status {} → {}", requestId, request.getStatus(), status);
        request.setStatus(status);
        requestRepo.save(request);
        notify(RecordChange.of(RecordType.REQUEST, requestId, status));
    }

    @Override
    @Transactional
    public void markRequestDispatched(String requestId) {
        RescueRequest request = requestRepo.findById(requestId)
                .orElseThrow(() -> new UnknownRequestException(requestId));
        if (request.isDispatched()) return;
        request.setDispatchedAt(Instant.now());
        requestRepo.save(request);
    }

    // ------------------------------------------------------------------
    // Damage reports
    // ------------------------------------------------------------------

    /**
     * Insert-if-absent first; if a row already exists, try the PENDING → ANALYZING
     * transition left behind by an operator reset. Both statements are
     * single-row conditional writes, so concurrent callers cannot both succeed.
     */
    @Override
    @Transactional
    public ClaimResult claimDamageReport(String requestId, String owner) {
        Instant now = Instant.now();
        if (reportRepo.insertClaim(requestId, owner, now) == 1
                || reportRepo.reclaimPending(requestId, owner, now) == 1) {
            notify(RecordChange.of(RecordType.DAMAGE_REPORT, requestId, AnalysisStatus.ANALYZING));
            return ClaimResult.ACQUIRED;
        }
        return ClaimResult.ALREADY_OWNED_OR_DONE;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<DamageReport> findDamageReport(String requestId) {
        return reportRepo.findById(requestId);
    }

    @Override
    @Transactional
    public boolean completeDamageReport(String requestId, String owner,
                                        List<DamageFinding> findings, String analysisModel) {
        Optional<DamageReport> locked = lockedAnalyzingReport(requestId, owner);
        if (locked.isEmpty()) return false;

        DamageReport report = locked.get();
        report.replaceFindings(findings);
        report.setAnalysisModel(analysisModel);
        report.setErrorSummary(null);
        report.setStatus(AnalysisStatus.COMPLETE);
        report.setCompletedAt(Instant.now());
        reportRepo.save(report);
        notify(RecordChange.of(RecordType.DAMAGE_REPORT, requestId, AnalysisStatus.COMPLETE));
        return true;
    }

    @Override
    @Transactional
    public boolean failDamageReport(String requestId, String owner, String errorSummary) {
        Optional<DamageReport> locked = lockedAnalyzingReport(requestId, owner);
        if (locked.isEmpty()) return false;

        DamageReport report = locked.get();
        report.setErrorSummary(errorSummary);
        report.setStatus(AnalysisStatus.FAILED);
        report.setCompletedAt(Instant.now());
        reportRepo.save(report);
        notify(RecordChange.of(RecordType.DAMAGE_REPORT, requestId, AnalysisStatus.FAILED));
        return true;
    }

    @Override
    @Transactional
    public void markLogisticsHandoff(String requestId) {
        reportRepo.findById(requestId).ifPresent(report -> {
            if (report.getHandoffAt() == null) {
                report.setHandoffAt(Instant.now());
                reportRepo.save(report);
            }
        });
    }

    @Override
    @Transactional
    public boolean resetFailedDamageReport(String requestId) {
        DamageReport report = reportRepo.lockByRequestId(requestId).orElse(null);
        if (report == null || report.getStatus() != AnalysisStatus.FAILED) return false;

        report.setStatus(AnalysisStatus.PENDING);
        report.setWorkerId(null);
        report.setErrorSummary(null);
        report.setCompletedAt(null);
        report.replaceFindings(List.of());
        reportRepo.save(report);
        notify(RecordChange.of(RecordType.DAMAGE_REPORT, requestId, AnalysisStatus.PENDING));
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public List<DamageReport> findStalledDamageClaims(Instant claimedBefore) {
        return reportRepo.findByStatusAndClaimedAtBefore(AnalysisStatus.ANALYZING, claimedBefore);
    }

    // ------------------------------------------------------------------
    // Logistics plans
    // ------------------------------------------------------------------

    @Override
    @Transactional
    public ClaimResult claimLogisticsPlan(String requestId, String owner) {
        Instant now = Instant.now();
        if (planRepo.insertClaim(requestId, owner, now) == 1
                || planRepo.reclaimPending(requestId, owner, now) == 1) {
            notify(RecordChange.of(RecordType.LOGISTICS_PLAN, requestId, PlanStatus.PLANNING));
            return ClaimResult.ACQUIRED;
        }
        return ClaimResult.ALREADY_OWNED_OR_DONE;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<LogisticsPlan> findLogisticsPlan(String requestId) {
        return planRepo.findById(requestId);
    }

    @Override
    @Transactional
    public boolean completeLogisticsPlan(String requestId, String owner, List<DeploymentAction> actions,
                                         String planningModel, String inventorySnapshot) {
        Optional<LogisticsPlan> locked = lockedPlanningPlan(requestId, owner);
        if (locked.isEmpty()) return false;

        LogisticsPlan plan = locked.get();
        plan.replaceActions(actions);
        plan.setPlanningModel(planningModel);
        plan.setInventorySnapshot(inventorySnapshot);
        plan.setErrorSummary(null);
        plan.setStatus(PlanStatus.COMPLETE);
        plan.setCompletedAt(Instant.now());
        planRepo.save(plan);
        notify(RecordChange.of(RecordType.LOGISTICS_PLAN, requestId, PlanStatus.COMPLETE));
        return true;
    }

    @Override
    @Transactional
    public boolean failLogisticsPlan(String requestId, String owner, String errorSummary) {
        Optional<LogisticsPlan> locked = lockedPlanningPlan(requestId, owner);
        if (locked.isEmpty()) return false;

        LogisticsPlan plan = locked.get();
        plan.setErrorSummary(errorSummary);
        plan.setStatus(PlanStatus.FAILED);
        plan.setCompletedAt(Instant.now());
        planRepo.save(plan);
        notify(RecordChange.of(RecordType.LOGISTICS_PLAN, requestId, PlanStatus.FAILED));
        return true;
    }

    @Override
    @Transactional
    public boolean resetFailedLogisticsPlan(String requestId) {
        LogisticsPlan plan = planRepo.lockByRequestId(requestId).orElse(null);
        if (plan == null || plan.getStatus() != PlanStatus.FAILED) return false;

        plan.setStatus(PlanStatus.PENDING);
        plan.setWorkerId(null);
        plan.setErrorSummary(null);
        plan.setCompletedAt(null);
        plan.replaceActions(List.of());
        planRepo.save(plan);
        notify(RecordChange.of(RecordType.LOGISTICS_PLAN, requestId, PlanStatus.PENDING));
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public List<LogisticsPlan> findStalledPlanningClaims(Instant claimedBefore) {
        return planRepo.findByStatusAndClaimedAtBefore(PlanStatus.PLANNING, claimedBefore);
    }

    // ------------------------------------------------------------------
    // Change notifications
    // ------------------------------------------------------------------

    @Override
    public Subscription subscribe(RecordType type, Consumer<RecordChange> listener) {
        return changeFeed.subscribe(type, listener);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Optional<DamageReport> lockedAnalyzingReport(String requestId, String owner) {
        Optional<DamageReport> report = reportRepo.lockByRequestId(requestId);
        if (report.isEmpty()
                || report.get().getStatus() != AnalysisStatus.ANALYZING
                || !report.get().isOwnedBy(owner)) {
            log.warn("Damage report {} is no longer claimed by '{}' (current={})", requestId, owner,
                    report.map(r -> r.getStatus() + "/" + r.getWorkerId()).orElse("absent"));
            return Optional.empty();
        }
        return report;
    }

    private Optional<LogisticsPlan> lockedPlanningPlan(String requestId, String owner) {
        Optional<LogisticsPlan> plan = planRepo.lockByRequestId(requestId);
        if (plan.isEmpty()
                || plan.get().getStatus() != PlanStatus.PLANNING
                || !plan.get().isOwnedBy(owner)) {
            log.warn("Logistics plan {} is no longer claimed by '{}' (current={})", requestId, owner,
                    plan.map(p -> p.getStatus() + "/" + p.getWorkerId()).orElse("absent"));
            return Optional.empty();
        }
        return plan;
    }

    private void notify(RecordChange change) {
        events.publishEvent(change);
    }
}
