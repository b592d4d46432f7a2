package com.reliefx.orchestrator.repository;

import com.reliefx.orchestrator.model.Trigger;
import com.reliefx.orchestrator.model.TriggerState;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + consumer queries for the triggers table.
 */
public interface TriggerRepository extends JpaRepository<Trigger, UUID> {

    /**
     * Lease the oldest deliverable triggers: the dequeue of the bus.
     *
     * PESSIMISTIC_WRITE with lock timeout -2 renders as
     * SELECT ... FOR UPDATE SKIP LOCKED on PostgreSQL:
     *   - FOR UPDATE  : no other transaction can lease the same rows
     *   - SKIP LOCKED : rows locked by another consumer are skipped, not waited on
     *
     * Must run inside a @Transactional method that marks the rows IN_FLIGHT
     * before the transaction commits.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2"))
    @Query("""
            SELECT t FROM Trigger t
            WHERE t.state = com.reliefx.orchestrator.model.TriggerState.PENDING
              AND t.availableAt <= :now
            ORDER BY t.availableAt ASC
            """)
    List<Trigger> findDeliverable(@Param("now") Instant now, Pageable page);

    /** Row lock for settling a delivery (ack / retry / dead-letter). */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM Trigger t WHERE t.id = :id")
    Optional<Trigger> lockById(@Param("id") UUID id);

    /**
     * IN_FLIGHT triggers whose consumer never acked (crashed or hung). Locked,
     * skipping rows a consumer is settling right now.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2"))
    List<Trigger> findByStateAndLeasedUntilBefore(TriggerState state, Instant cutoff);

    List<Trigger> findTop100ByStateOrderByUpdatedAtDesc(TriggerState state);

    List<Trigger> findByRequestIdOrderByCreatedAtAsc(String requestId);
}
