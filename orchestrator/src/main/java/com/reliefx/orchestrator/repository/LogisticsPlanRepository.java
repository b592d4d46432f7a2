package com.reliefx.orchestrator.repository;

import com.reliefx.orchestrator.model.LogisticsPlan;
import com.reliefx.orchestrator.model.PlanStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * CRUD + claim queries for the logistics_plans table.
 */
public interface LogisticsPlanRepository extends JpaRepository<LogisticsPlan, String> {

    /**
     * Conditional create: the logistics stage's claim.
     *
     * The row is selected from damage_reports, so nothing is inserted unless a
     * COMPLETE report exists for the request. A plan therefore never exists,
     * not even as a PLANNING placeholder, next to an incomplete report.
     */
    @Modifying(clearAutomatically = true)
    @Query(nativeQuery = true, value = """
            INSERT INTO logistics_plans
                (request_id, status, worker_id, attempt, claimed_at, created_at, updated_at)
            SELECT d.request_id, 'PLANNING', :workerId, 1, :now, :now, :now
              FROM damage_reports d
             WHERE d.request_id = :requestId
               AND d.status = 'COMPLETE'
            ON CONFLICT (request_id) DO NOTHING
            """)
    int insertClaim(@Param("requestId") String requestId,
                    @Param("workerId") String workerId,
                    @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE LogisticsPlan p
               SET p.status = com.reliefx.orchestrator.model.PlanStatus.PLANNING,
                   p.workerId = :workerId,
                   p.attempt = p.attempt + 1,
                   p.claimedAt = :now,
                   p.updatedAt = :now
             WHERE p.requestId = :requestId
               AND p.status = com.reliefx.orchestrator.model.PlanStatus.PENDING
            """)
    int reclaimPending(@Param("requestId") String requestId,
                       @Param("workerId") String workerId,
                       @Param("now") Instant now);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM LogisticsPlan p WHERE p.requestId = :requestId")
    Optional<LogisticsPlan> lockByRequestId(@Param("requestId") String requestId);

    List<LogisticsPlan> findByStatusAndClaimedAtBefore(PlanStatus status, Instant cutoff);
}
