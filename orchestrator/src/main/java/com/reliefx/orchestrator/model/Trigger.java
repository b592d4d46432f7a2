package com.reliefx.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One message on the Trigger Bus.
 *
 * The consumer claims a PENDING trigger via SELECT FOR UPDATE SKIP LOCKED,
 * sets state = IN_FLIGHT with a lease, runs the stage handler, then acks it.
 * Rows are kept after ACKED/DEAD so deliveries stay auditable.
 *
 * DB table: triggers  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "triggers")
public class Trigger {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private TriggerTopic topic;

    @Column(name = "request_id", nullable = false, updatable = false, length = 36)
    private String requestId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TriggerState state = TriggerState.PENDING;

    // Number of times this trigger has been handed to a consumer.
    @Column(name = "delivery_count", nullable = false)
    private int deliveryCount = 0;

    // Not eligible for delivery before this instant (backoff).
    @Column(name = "available_at", nullable = false)
    private Instant availableAt = Instant.now();

    // While IN_FLIGHT: the consumer must ack before this instant or the
    // trigger is redelivered.
    @Column(name = "leased_until")
    private Instant leasedUntil;

    @Column
    private String consumer;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Column(name = "acked_at")
    private Instant ackedAt;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Trigger() {}   // required by JPA

    public Trigger(TriggerTopic topic, String requestId) {
        this.topic     = topic;
        this.requestId = requestId;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID         getId()            { return id; }
    public TriggerTopic getTopic()         { return topic; }
    public String       getRequestId()     { return requestId; }
    public TriggerState getState()         { return state; }
    public int          getDeliveryCount() { return deliveryCount; }
    public Instant      getAvailableAt()   { return availableAt; }
    public Instant      getLeasedUntil()   { return leasedUntil; }
    public String       getConsumer()      { return consumer; }
    public String       getLastError()     { return lastError; }
    public Instant      getCreatedAt()     { return createdAt; }
    public Instant      getUpdatedAt()     { return updatedAt; }
    public Instant      getAckedAt()       { return ackedAt; }

    public void setState(TriggerState state)   { this.state = state; }
    public void setAvailableAt(Instant t)      { this.availableAt = t; }
    public void setLeasedUntil(Instant t)      { this.leasedUntil = t; }
    public void setConsumer(String consumer)   { this.consumer = consumer; }
    public void setLastError(String lastError) { this.lastError = lastError; }
    public void setAckedAt(Instant t)          { this.ackedAt = t; }
    public void incrementDeliveryCount()       { this.deliveryCount++; }
}
