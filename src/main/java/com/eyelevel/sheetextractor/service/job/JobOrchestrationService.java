package com.eyelevel.sheetextractor.service.job;

import com.eyelevel.sheetextractor.config.ExtractionEngineConfig;
import com.eyelevel.sheetextractor.dto.extraction.ExtractionResponse;
import com.eyelevel.sheetextractor.dto.job.JobFilter;
import com.eyelevel.sheetextractor.dto.job.JobResponse;
import com.eyelevel.sheetextractor.exception.apiclient.BadRequestException;
import com.eyelevel.sheetextractor.exception.apiclient.ConflictException;
import com.eyelevel.sheetextractor.exception.apiclient.NotFoundException;
import com.eyelevel.sheetextractor.model.Extraction;
import com.eyelevel.sheetextractor.model.ExtractionJob;
import com.eyelevel.sheetextractor.model.JobStatus;
import com.eyelevel.sheetextractor.queue.AfterCommitEnqueuer;
import com.eyelevel.sheetextractor.repository.DocumentRepository;
import com.eyelevel.sheetextractor.repository.ExtractionJobRepository;
import com.eyelevel.sheetextractor.repository.ExtractionRepository;
import com.eyelevel.sheetextractor.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Entry point for callers of the extraction engine: creates and cancels jobs and serves job and extraction
 * reads. Running jobs are advanced only by workers through {@link JobStore}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobOrchestrationService {

    public static final int DEFAULT_PAGE_SIZE = 100;
    public static final int MAX_PAGE_SIZE = 500;
    private static final int CANCEL_ATTEMPTS = 3;
    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt");

    private final ExtractionJobRepository jobRepository;
    private final ExtractionRepository extractionRepository;
    private final DocumentRepository documentRepository;
    private final JobStore jobStore;
    private final AfterCommitEnqueuer afterCommitEnqueuer;
    private final ExtractionEngineConfig engineConfig;

    /**
     * Creates a PENDING job for a document and enqueues it once the insert has committed.
     *
     * @param documentId The document to process.
     * @return The new job.
     * @throws NotFoundException if the document does not exist.
     * @throws ConflictException if the document already has a PENDING or PROCESSING job.
     */
    @Transactional
    public JobResponse createJob(final UUID documentId) {
        if (!documentRepository.existsById(documentId)) {
            throw new NotFoundException("Document not found: " + documentId);
        }
        if (jobRepository.existsByActiveDocumentId(documentId)) {
            throw new ConflictException("Document " + documentId + " already has an active job.");
        }

        ExtractionJob job = new ExtractionJob();
        job.setId(UUID.randomUUID());
        job.setDocumentId(documentId);
        job.setActiveDocumentId(documentId);
        job.setStatus(JobStatus.PENDING);
        job.setProgress(0.0);
        job.setMaxAttempts(Math.max(1, engineConfig.getWatchdog().getMaxAttempts()));
        job.setCurrentStage(JobStatus.PENDING.name());
        try {
            job = jobRepository.saveAndFlush(job);
        } catch (final DataIntegrityViolationException e) {
            log.warn("Concurrent job creation for document {} lost on the active-job constraint.", documentId);
            throw new ConflictException("Document " + documentId + " already has an active job.");
        }

        afterCommitEnqueuer.enqueueAfterCommit(job.getId());
        log.info("[{}] Created PENDING job for document {}.", job.getId(), documentId);
        return JobResponse.from(job);
    }

    /**
     * Cancels a job. A PENDING job is canceled at once. A PROCESSING job gets its cancellation flag set and
     * is canceled by its worker at the next checkpoint, so the returned view may still show PROCESSING.
     *
     * @param jobId The job to cancel.
     * @return The job as it stands after the request.
     * @throws NotFoundException if the job does not exist.
     * @throws ConflictException if the job already finished.
     */
    public JobResponse cancelJob(final UUID jobId) {
        for (int attempt = 0; attempt < CANCEL_ATTEMPTS; attempt++) {
            final ExtractionJob job = findJob(jobId);
            if (job.getStatus().isTerminal()) {
                throw new ConflictException("Job " + jobId + " is already " + job.getStatus() + ".");
            }
            final boolean applied = job.getStatus() == JobStatus.PENDING ? jobStore.cancelPending(jobId)
                                                                          : jobStore.requestCancel(jobId);
            if (applied) {
                log.info("[{}] Cancellation {} while {}.",
                         jobId, job.getStatus() == JobStatus.PENDING ? "applied" : "requested", job.getStatus());
                return JobResponse.from(findJob(jobId));
            }
            log.debug("[{}] Cancel raced with a status change from {}. Re-reading.", jobId, job.getStatus());
        }
        final ExtractionJob job = findJob(jobId);
        if (job.getStatus().isTerminal()) {
            throw new ConflictException("Job " + jobId + " is already " + job.getStatus() + ".");
        }
        return JobResponse.from(job);
    }

    @Transactional(readOnly = true)
    public JobResponse getJob(final UUID jobId) {
        return JobResponse.from(findJob(jobId));
    }

    @Transactional(readOnly = true)
    public JobStatus getStatus(final UUID jobId) {
        return findJob(jobId).getStatus();
    }

    /**
     * Lists jobs newest first.
     *
     * @param filter Optional status and document criteria.
     * @param page   Zero-based page index.
     * @param size   Page size; null means {@value #DEFAULT_PAGE_SIZE}, at most {@value #MAX_PAGE_SIZE}.
     * @return One page of jobs.
     */
    @Transactional(readOnly = true)
    public Page<JobResponse> listJobs(final JobFilter filter, final int page, final Integer size) {
        final int pageSize = size == null ? DEFAULT_PAGE_SIZE : size;
        if (page < 0 || pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new BadRequestException(
                    "Invalid page request: page=" + page + ", size=" + pageSize + " (size must be 1.." + MAX_PAGE_SIZE
                    + ").");
        }
        final Pageable pageable = PageRequest.of(page, pageSize, NEWEST_FIRST);
        final JobFilter criteria = filter == null ? JobFilter.none() : filter;

        final Page<ExtractionJob> jobs;
        if (criteria.status() != null && criteria.documentId() != null) {
            jobs = jobRepository.findByStatusAndDocumentId(criteria.status(), criteria.documentId(), pageable);
        } else if (criteria.status() != null) {
            jobs = jobRepository.findByStatus(criteria.status(), pageable);
        } else if (criteria.documentId() != null) {
            jobs = jobRepository.findByDocumentId(criteria.documentId(), pageable);
        } else {
            jobs = jobRepository.findAll(pageable);
        }
        return jobs.map(JobResponse::from);
    }

    @Transactional(readOnly = true)
    public List<JobResponse> listJobsForDocument(final UUID documentId) {
        return jobRepository.findByDocumentIdOrderByCreatedAtDesc(documentId).stream().map(JobResponse::from)
                            .toList();
    }

    /**
     * @throws NotFoundException if the job does not exist or has no extraction yet.
     */
    @Transactional(readOnly = true)
    public ExtractionResponse getExtractionForJob(final UUID jobId) {
        findJob(jobId);
        return extractionRepository.findByJobId(jobId).map(ExtractionResponse::from).orElseThrow(
                () -> new NotFoundException("No extraction for job " + jobId + "."));
    }

    @Transactional(readOnly = true)
    public List<ExtractionResponse> listExtractionsForDocument(final UUID documentId) {
        return extractionRepository.findByDocumentIdOrderByExtractedAtDesc(documentId).stream()
                                   .map(ExtractionResponse::from).toList();
    }

    /**
     * Replaces the notes of a job's extraction, the only field of an extraction that can change.
     */
    @Transactional
    public ExtractionResponse annotateExtraction(final UUID jobId, final String notes) {
        final Extraction extraction = extractionRepository.findByJobId(jobId).orElseThrow(
                () -> new NotFoundException("No extraction for job " + jobId + "."));
        extraction.setNotes(notes);
        log.info("[{}] Updated extraction notes.", jobId);
        return ExtractionResponse.from(extractionRepository.save(extraction));
    }

    /**
     * Records progress for a running attempt. Never throws for a stale token or a backwards value; those
     * writes are ignored.
     *
     * @return true if the progress was recorded.
     */
    public boolean updateProgress(final UUID jobId, final double percent, final UUID attemptToken) {
        return jobStore.updateProgress(jobId, attemptToken, percent);
    }

    private ExtractionJob findJob(final UUID jobId) {
        return jobRepository.findById(jobId).orElseThrow(() -> new NotFoundException("Job not found: " + jobId));
    }
}
