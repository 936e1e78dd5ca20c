package org.caureq.selfrepair.repo;

import org.caureq.selfrepair.domain.RepairAttempt;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface RepairAttemptRepo extends JpaRepository<RepairAttempt, Long> {
    Page<RepairAttempt> findAll(Pageable pageable);
    Page<RepairAttempt> findByComponentName(String componentName, Pageable pageable);
    List<RepairAttempt> findByIncidentIdOrderByIdAsc(String incidentId);
    long countByComponentNameAndRepairTierAndCreatedAtGreaterThanEqual(String componentName, Integer repairTier, Instant since);

    long countByCreatedAtGreaterThanEqual(Instant since);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update RepairAttempt a set a.resolvedAt = :at where a.incidentId = :incident and a.resolvedAt is null")
    int resolveIncident(@Param("incident") String incidentId, @Param("at") Instant at);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from RepairAttempt a where a.createdAt < :cutoff")
    int deleteCreatedBefore(@Param("cutoff") Instant cutoff);

    /** Rows of [tier, outcome, count]; outcome is null for attempts still running. */
    @Query("select a.repairTier, a.repairOutcome, count(a) from RepairAttempt a where a.createdAt >= :since group by a.repairTier, a.repairOutcome")
    List<Object[]> countByTierAndOutcome(@Param("since") Instant since);
}
