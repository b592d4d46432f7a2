package com.reliefx.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered resource-deployment actions produced from a complete DamageReport.
 *
 * Like {@link DamageReport}, the row is created by the claim (status = PLANNING).
 * The claim insert only succeeds while the owning report is COMPLETE.
 *
 * DB tables: logistics_plans, deployment_actions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "logistics_plans")
public class LogisticsPlan {

    @Id
    @Column(name = "request_id", nullable = false, updatable = false, length = 36)
    private String requestId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PlanStatus status = PlanStatus.PLANNING;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "deployment_actions", joinColumns = @JoinColumn(name = "request_id"))
    @OrderColumn(name = "position")
    private List<DeploymentAction> actions = new ArrayList<>();

    @Column(name = "error_summary", columnDefinition = "TEXT")
    private String errorSummary;

    @Column(name = "planning_model")
    private String planningModel;

    // JSON object of resource type → units available when the plan was generated.
    @Column(name = "inventory_snapshot", columnDefinition = "TEXT")
    private String inventorySnapshot;

    @Column(name = "worker_id")
    private String workerId;

    @Column(nullable = false)
    private int attempt = 1;

    @Column(name = "claimed_at")
    private Instant claimedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

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

    protected LogisticsPlan() {}   // required by JPA

    public LogisticsPlan(String requestId, String workerId) {
        this.requestId = requestId;
        this.workerId  = workerId;
        this.claimedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String                 getRequestId()         { return requestId; }
    public PlanStatus             getStatus()            { return status; }
    public List<DeploymentAction> getActions()           { return actions; }
    public String                 getErrorSummary()      { return errorSummary; }
    public String                 getPlanningModel()     { return planningModel; }
    public String                 getInventorySnapshot() { return inventorySnapshot; }
    public String                 getWorkerId()          { return workerId; }
    public int                    getAttempt()           { return attempt; }
    public Instant                getClaimedAt()         { return claimedAt; }
    public Instant                getCompletedAt()       { return completedAt; }
    public Instant                getCreatedAt()         { return createdAt; }
    public Instant                getUpdatedAt()         { return updatedAt; }

    public void setStatus(PlanStatus status)             { this.status = status; }
    public void setErrorSummary(String errorSummary)     { this.errorSummary = errorSummary; }
    public void setPlanningModel(String model)           { this.planningModel = model; }
    public void setInventorySnapshot(String snapshot)    { this.inventorySnapshot = snapshot; }
    public void setWorkerId(String workerId)             { this.workerId = workerId; }
    public void setClaimedAt(Instant t)                  { this.claimedAt = t; }
    public void setCompletedAt(Instant t)                { this.completedAt = t; }
    public void incrementAttempt()                       { this.attempt++; }

    public void replaceActions(List<DeploymentAction> newActions) {
        this.actions.clear();
        this.actions.addAll(newActions);
    }

    public boolean isOwnedBy(String owner) {
        return owner != null && owner.equals(workerId);
    }
}
