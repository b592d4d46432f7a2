package com.reliefx.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Structured findings produced by analysing the imagery of one RescueRequest.
 *
 * The row is first created by the claim itself (status = ANALYZING) through a
 * conditional insert, so its existence doubles as the damage stage's lock.
 * Only the worker named in {@code workerId} may complete or fail it.
 *
 * DB tables: damage_reports, damage_findings  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "damage_reports")
public class DamageReport {

    @Id
    @Column(name = "request_id", nullable = false, updatable = false, length = 36)
    private String requestId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AnalysisStatus status = AnalysisStatus.ANALYZING;

    // Ordered as returned by the analysis engine.
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "damage_findings", joinColumns = @JoinColumn(name = "request_id"))
    @OrderColumn(name = "position")
    private List<DamageFinding> findings = new ArrayList<>();

    @Column(name = "error_summary", columnDefinition = "TEXT")
    private String errorSummary;

    // Model identifier reported by the analysis engine.
    @Column(name = "analysis_model")
    private String analysisModel;

    // Owner of the current claim.
    @Column(name = "worker_id")
    private String workerId;

    // Number of claims taken on this record (1 + operator reprocesses).
    @Column(nullable = false)
    private int attempt = 1;

    @Column(name = "claimed_at")
    private Instant claimedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    // Set once the logistics trigger for this report has been enqueued.
    @Column(name = "handoff_at")
    private Instant handoffAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected DamageReport() {}   // required by JPA

    public DamageReport(String requestId, String workerId) {
        this.requestId = requestId;
        this.workerId  = workerId;
        this.claimedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String              getRequestId()     { return requestId; }
    public AnalysisStatus      getStatus()        { return status; }
    public List<DamageFinding> getFindings()      { return findings; }
    public String              getErrorSummary()  { return errorSummary; }
    public String              getAnalysisModel() { return analysisModel; }
    public String              getWorkerId()      { return workerId; }
    public int                 getAttempt()       { return attempt; }
    public Instant             getClaimedAt()     { return claimedAt; }
    public Instant             getCompletedAt()   { return completedAt; }
    public Instant             getHandoffAt()     { return handoffAt; }
    public Instant             getCreatedAt()     { return createdAt; }
    public Instant             getUpdatedAt()     { return updatedAt; }

    public void setStatus(AnalysisStatus status)      { this.status = status; }
    public void setErrorSummary(String errorSummary)  { this.errorSummary = errorSummary; }
    public void setAnalysisModel(String model)        { this.analysisModel = model; }
    public void setWorkerId(String workerId)          { this.workerId = workerId; }
    public void setClaimedAt(Instant t)               { this.claimedAt = t; }
    public void setCompletedAt(Instant t)             { this.completedAt = t; }
    public void setHandoffAt(Instant t)               { this.handoffAt = t; }
    public void incrementAttempt()                    { this.attempt++; }

    public void replaceFindings(List<DamageFinding> newFindings) {
        this.findings.clear();
        this.findings.addAll(newFindings);
    }

    public boolean isOwnedBy(String owner) {
        return owner != null && owner.equals(workerId);
    }
}
