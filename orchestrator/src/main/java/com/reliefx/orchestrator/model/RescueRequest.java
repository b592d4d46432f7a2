package com.reliefx.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * The unit of work submitted for a disaster area.
 *
 * Written once by the Intake Router. Downstream stages only ever touch
 * {@code status}; the router and the dispatch reconciler set {@code dispatchedAt}
 * once the first damage trigger is durably enqueued.
 *
 * DB table: rescue_requests  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "rescue_requests")
public class RescueRequest {

    // Time-ordered random id generated at intake. The join key for every other record.
    @Id
    @Column(name = "request_id", nullable = false, updatable = false, length = 36)
    private String requestId;

    @Column(name = "region_name", nullable = false, updatable = false)
    private String regionName;

    @Column(name = "event_name", nullable = false, updatable = false)
    private String eventName;

    // Optional GeoJSON polygon narrowing the region.
    @Column(name = "area_of_interest", columnDefinition = "TEXT", updatable = false)
    private String areaOfInterest;

    @Column(name = "pre_event_imagery", nullable = false, updatable = false, length = 2048)
    private String preEventImagery;

    @Column(name = "post_event_imagery", nullable = false, updatable = false, length = 2048)
    private String postEventImagery;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RequestStatus status = RequestStatus.SUBMITTED;

    // Null until the damage trigger has been published. A null value on an
    // old row is the "written but never triggered" stuck state.
    @Column(name = "dispatched_at")
    private Instant dispatchedAt;

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

    protected RescueRequest() {}   // required by JPA

    public RescueRequest(String requestId,
                         String regionName,
                         String eventName,
                         String areaOfInterest,
                         String preEventImagery,
                         String postEventImagery) {
        this.requestId        = requestId;
        this.regionName       = regionName;
        this.eventName        = eventName;
        this.areaOfInterest   = areaOfInterest;
        this.preEventImagery  = preEventImagery;
        this.postEventImagery = postEventImagery;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String        getRequestId()        { return requestId; }
    public String        getRegionName()       { return regionName; }
    public String        getEventName()        { return eventName; }
    public String        getAreaOfInterest()   { return areaOfInterest; }
    public String        getPreEventImagery()  { return preEventImagery; }
    public String        getPostEventImagery() { return postEventImagery; }
    public RequestStatus getStatus()           { return status; }
    public Instant       getDispatchedAt()     { return dispatchedAt; }
    public Instant       getCreatedAt()        { return createdAt; }
    public Instant       getUpdatedAt()        { return updatedAt; }

    public void setStatus(RequestStatus status)   { this.status = status; }
    public void setDispatchedAt(Instant t)        { this.dispatchedAt = t; }
    public void setCreatedAt(Instant t)           { this.createdAt = t; }

    public boolean isDispatched() { return dispatchedAt != null; }
}
