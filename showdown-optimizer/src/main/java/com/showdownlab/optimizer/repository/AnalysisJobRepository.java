package com.showdownlab.optimizer.repository;

import com.showdownlab.optimizer.domain.AnalysisJob;
import com.showdownlab.optimizer.domain.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for analysis jobs. Status changes go through conditional
 * updates so two workers can never both claim the same job.
 */
@Repository
public interface AnalysisJobRepository extends JpaRepository<AnalysisJob, Long> {

    Optional<AnalysisJob> findByIdempotencyKey(String idempotencyKey);

    List<AnalysisJob> findByStatus(JobStatus status);

    @Query("SELECT j.status FROM AnalysisJob j WHERE j.id = :id")
    Optional<JobStatus> findStatusById(@Param("id") Long id);

    /**
     * Move a job to {@code next} only if it is currently in one of {@code expected}.
     *
     * @return number of rows changed (0 or 1)
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE AnalysisJob j SET j.status = :next, j.updatedAt = :now, j.version = j.version + 1 "
            + "WHERE j.id = :id AND j.status IN :expected")
    int transitionStatus(@Param("id") Long id,
            @Param("expected") Collection<JobStatus> expected,
            @Param("next") JobStatus next,
            @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE AnalysisJob j SET j.progressPercent = :percent, j.progressMessage = :message, j.updatedAt = :now "
            + "WHERE j.id = :id")
    int updateProgress(@Param("id") Long id,
            @Param("percent") int percent,
            @Param("message") String message,
            @Param("now") LocalDateTime now);

    /**
     * Store the final report and status, provided the job is still running.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE AnalysisJob j SET j.status = :next, j.resultJson = :resultJson, j.progressPercent = 100, "
            + "j.updatedAt = :now, j.version = j.version + 1 WHERE j.id = :id AND j.status = :expected")
    int completeJob(@Param("id") Long id,
            @Param("expected") JobStatus expected,
            @Param("next") JobStatus next,
            @Param("resultJson") String resultJson,
            @Param("now") LocalDateTime now);

    /**
     * Attach a partial report to a job that was cancelled while running.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE AnalysisJob j SET j.resultJson = :resultJson, j.updatedAt = :now WHERE j.id = :id")
    int attachResult(@Param("id") Long id,
            @Param("resultJson") String resultJson,
            @Param("now") LocalDateTime now);
}
