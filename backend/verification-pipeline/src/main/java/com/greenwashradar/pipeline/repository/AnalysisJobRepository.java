package com.greenwashradar.pipeline.repository;

import com.greenwashradar.pipeline.entity.AnalysisJob;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface AnalysisJobRepository extends JpaRepository<AnalysisJob, String> {

    /**
     * Non-archived jobs for a key, newest first. Normally at most one.
     */
    List<AnalysisJob> findByJobKeyAndArchivedFalseOrderByCreatedAtDesc(String jobKey);

    /**
     * Latest job for a key, archived or not
     */
    Optional<AnalysisJob> findFirstByJobKeyOrderByCreatedAtDesc(String jobKey);

    /**
     * Row-locked read used by compare-and-advance
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM AnalysisJob j WHERE j.id = :jobId")
    Optional<AnalysisJob> findByIdForUpdate(@Param("jobId") String jobId);

    /**
     * Delete archived jobs older than the cutoff
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM AnalysisJob j WHERE j.archived = true AND j.archivedAt < :before")
    int deleteArchivedBefore(@Param("before") LocalDateTime before);

    long countByArchivedFalse();
}
