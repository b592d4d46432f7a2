package com.reliefx.orchestrator.repository;

import com.reliefx.orchestrator.model.RequestStatus;
import com.reliefx.orchestrator.model.RescueRequest;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;

/**
 * CRUD + query operations for the rescue_requests table.
 */
public interface RescueRequestRepository extends JpaRepository<RescueRequest, String> {

    /** Newest first; used by the observer listing. */
    List<RescueRequest> findTop100ByStatusOrderByCreatedAtDesc(RequestStatus status);

    List<RescueRequest> findTop100ByOrderByCreatedAtDesc();

    /**
     * Requests whose damage trigger was never published.
     * The dispatch reconciler re-publishes these.
     */
    List<RescueRequest> findByDispatchedAtIsNullAndCreatedAtBefore(Instant cutoff);
}
