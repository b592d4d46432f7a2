package com.reliefx.orchestrator.repository;

import com.reliefx.orchestrator.model.AnalysisStatus;
import com.reliefx.orchestrator.model.DamageReport;
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
 * CRUD + claim queries for the damage_reports table.
 */
public interface DamageReportRepository extends JpaRepository<DamageReport, String> {

    /**
     * Conditional create: the damage stage's claim.
     *
     * ON CONFLICT DO NOTHING makes the insert a no-op when any report already
     * exists for the request, whatever its status. Returns 1 for the single
     * winner and 0 for everyone else, including concurrent callers racing on
     * the same primary key.
     *
     * Must run inside a @Transactional method in the store layer.
     */
    @Modifying(clearAutomatically = true)
    @Query(nativeQuery = true, value = """
            INSERT INTO damage_reports
                (request_id, status, worker_id, attempt, claimed_at, created_at, updated_at)
            VALUES
                (:requestId, 'ANALYZING', :workerId, 1, :now, :now, :now)
            ON CONFLICT (request_id) DO NOTHING
            """)
    int insertClaim(@Param("requestId") String requestId,
                    @Param("workerId") String workerId,
                    @Param("now") Instant now);

    /**
     * Re-claim a report that an operator reset to PENDING.
     * The WHERE clause on status makes this single-writer-wins as well.
     */
    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE DamageReport d
               SET d.status = com.reliefx.orchestrator.model.AnalysisStatus.ANALYZING,
                   d.workerId = :workerId,
                   d.attempt = d.attempt + 1,
                   d.claimedAt = :now,
                   d.updatedAt = :now
             WHERE d.requestId = :requestId
               AND d.status = com.reliefx.orchestrator.model.AnalysisStatus.PENDING
            """)
    int reclaimPending(@Param("requestId") String requestId,
                       @Param("workerId") String workerId,
                       @Param("now") Instant now);

    /** Row lock for owner-checked transitions (complete / fail / reset). */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM DamageReport d WHERE d.requestId = :requestId")
    Optional<DamageReport> lockByRequestId(@Param("requestId") String requestId);

    /** Claims older than 'cutoff' still in the given status (crashed workers). */
    List<DamageReport> findByStatusAndClaimedAtBefore(AnalysisStatus status, Instant cutoff);
}
