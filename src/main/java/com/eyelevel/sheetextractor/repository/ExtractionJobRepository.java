package com.eyelevel.sheetextractor.repository;

import com.eyelevel.sheetextractor.model.ExtractionJob;
import com.eyelevel.sheetextractor.model.JobStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Spring Data JPA repository for the {@link ExtractionJob} entity.
 * <p>
 * Every state change is a conditional bulk update whose {@code WHERE} clause carries the expected
 * current state (and, for worker writes, the claim token). The returned row count tells the caller
 * whether it won. Bulk updates bypass {@code @UpdateTimestamp}, so {@code updatedAt} is set explicitly.
 */
@Repository
public interface ExtractionJobRepository extends JpaRepository<ExtractionJob, UUID> {

    boolean existsByActiveDocumentId(UUID documentId);

    Page<ExtractionJob> findByStatus(JobStatus status, Pageable pageable);

    Page<ExtractionJob> findByDocumentId(UUID documentId, Pageable pageable);

    Page<ExtractionJob> findByStatusAndDocumentId(JobStatus status, UUID documentId, Pageable pageable);

    List<ExtractionJob> findByDocumentIdOrderByCreatedAtDesc(UUID documentId);

    /**
     * Used by the watchdog to find PENDING jobs whose queue message may have been lost. {@code updatedAt}
     * is the creation time or the last re-enqueue.
     */
    List<ExtractionJob> findByStatusAndUpdatedAtBefore(JobStatus status, LocalDateTime threshold);

    /**
     * Used by the watchdog to find PROCESSING jobs whose worker stopped sending heartbeats.
     */
    List<ExtractionJob> findByStatusAndHeartbeatAtBefore(JobStatus status, LocalDateTime threshold);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ExtractionJob j SET j.status = :processing, j.attemptToken = :token, j.attempts = j.attempts + 1, "
           + "j.heartbeatAt = :now, j.updatedAt = :now, j.currentStage = :stage "
           + "WHERE j.id = :id AND (j.status = :pending OR (j.status = :processing AND j.attemptToken IS NULL))")
    int claim(@Param("id") UUID id, @Param("token") UUID token, @Param("now") LocalDateTime now,
              @Param("stage") String stage, @Param("pending") JobStatus pending,
              @Param("processing") JobStatus processing);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ExtractionJob j SET j.progress = :progress, j.heartbeatAt = :now, j.updatedAt = :now "
           + "WHERE j.id = :id AND j.attemptToken = :token AND j.status = :processing AND j.progress <= :progress")
    int advanceProgress(@Param("id") UUID id, @Param("token") UUID token, @Param("progress") double progress,
                        @Param("now") LocalDateTime now, @Param("processing") JobStatus processing);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ExtractionJob j SET j.currentStage = :stage, j.heartbeatAt = :now, j.updatedAt = :now "
           + "WHERE j.id = :id AND j.attemptToken = :token AND j.status = :processing")
    int markStage(@Param("id") UUID id, @Param("token") UUID token, @Param("stage") String stage,
                  @Param("now") LocalDateTime now, @Param("processing") JobStatus processing);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ExtractionJob j SET j.heartbeatAt = :now "
           + "WHERE j.id = :id AND j.attemptToken = :token AND j.status = :processing")
    int heartbeat(@Param("id") UUID id, @Param("token") UUID token, @Param("now") LocalDateTime now,
                  @Param("processing") JobStatus processing);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ExtractionJob j SET j.status = :canceled, j.activeDocumentId = NULL, j.completedAt = :now, "
           + "j.updatedAt = :now, j.currentStage = :stage WHERE j.id = :id AND j.status = :pending")
    int cancelPending(@Param("id") UUID id, @Param("now") LocalDateTime now, @Param("stage") String stage,
                      @Param("pending") JobStatus pending, @Param("canceled") JobStatus canceled);

    /**
     * Stamps a PENDING job that has sat untouched since {@code threshold}. Only one watchdog pass per
     * threshold window wins, so a waiting job is re-enqueued at most once per window.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ExtractionJob j SET j.updatedAt = :now "
           + "WHERE j.id = :id AND j.status = :pending AND j.updatedAt < :threshold")
    int touchPending(@Param("id") UUID id, @Param("threshold") LocalDateTime threshold,
                     @Param("now") LocalDateTime now, @Param("pending") JobStatus pending);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ExtractionJob j SET j.cancelRequested = true, j.updatedAt = :now "
           + "WHERE j.id = :id AND j.status = :processing")
    int requestCancel(@Param("id") UUID id, @Param("now") LocalDateTime now,
                      @Param("processing") JobStatus processing);

    /**
     * Moves a claimed job to a terminal status. Only the holder of the current token wins.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ExtractionJob j SET j.status = :terminal, j.progress = :progress, j.error = :error, "
           + "j.retryCount = :retryCount, j.currentStage = :stage, j.attemptToken = NULL, "
           + "j.activeDocumentId = NULL, j.completedAt = :now, j.updatedAt = :now "
           + "WHERE j.id = :id AND j.attemptToken = :token AND j.status = :processing")
    int finalizeClaimed(@Param("id") UUID id, @Param("token") UUID token, @Param("terminal") JobStatus terminal,
                        @Param("progress") double progress, @Param("error") String error,
                        @Param("retryCount") int retryCount, @Param("stage") String stage,
                        @Param("now") LocalDateTime now, @Param("processing") JobStatus processing);

    /**
     * Moves a stale PROCESSING job to a terminal status on behalf of the watchdog. The heartbeat
     * condition is re-checked so a worker that recovered in the meantime keeps its job.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ExtractionJob j SET j.status = :terminal, j.error = :error, j.currentStage = :stage, "
           + "j.attemptToken = NULL, j.activeDocumentId = NULL, j.completedAt = :now, j.updatedAt = :now "
           + "WHERE j.id = :id AND j.status = :processing AND j.heartbeatAt < :staleBefore")
    int finalizeStale(@Param("id") UUID id, @Param("terminal") JobStatus terminal, @Param("error") String error,
                      @Param("stage") String stage, @Param("staleBefore") LocalDateTime staleBefore,
                      @Param("now") LocalDateTime now, @Param("processing") JobStatus processing);

    /**
     * Revokes the claim of a stale PROCESSING job so the next delivery can claim it again. Later
     * writes by the previous holder no longer match its token.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ExtractionJob j SET j.attemptToken = NULL, j.heartbeatAt = :now, j.updatedAt = :now, "
           + "j.currentStage = :stage WHERE j.id = :id AND j.status = :processing AND j.heartbeatAt < :staleBefore "
           + "AND j.cancelRequested = false AND j.attempts < j.maxAttempts")
    int revokeStaleClaim(@Param("id") UUID id, @Param("stage") String stage,
                         @Param("staleBefore") LocalDateTime staleBefore, @Param("now") LocalDateTime now,
                         @Param("processing") JobStatus processing);
}
