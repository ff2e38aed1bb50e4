package com.eyelevel.sheetextractor.store;

import com.eyelevel.sheetextractor.model.Document;
import com.eyelevel.sheetextractor.model.DocumentStatus;
import com.eyelevel.sheetextractor.model.Extraction;
import com.eyelevel.sheetextractor.model.ExtractionJob;
import com.eyelevel.sheetextractor.model.JobStatus;
import com.eyelevel.sheetextractor.pipeline.PipelineResult;
import com.eyelevel.sheetextractor.queue.AfterCommitEnqueuer;
import com.eyelevel.sheetextractor.queue.WorkQueue;
import com.eyelevel.sheetextractor.repository.DocumentRepository;
import com.eyelevel.sheetextractor.repository.ExtractionJobRepository;
import com.eyelevel.sheetextractor.repository.ExtractionRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Runs against a real database without a surrounding test transaction, so every store call commits on
 * its own like it does in production.
 */
@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({JobStore.class, AfterCommitEnqueuer.class})
@TestPropertySource(properties = "spring.datasource.url=jdbc:h2:mem:job_store_test;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000")
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JobStoreTest {

    @Autowired
    private JobStore jobStore;
    @Autowired
    private ExtractionJobRepository jobRepository;
    @Autowired
    private ExtractionRepository extractionRepository;
    @Autowired
    private DocumentRepository documentRepository;

    @MockBean
    private WorkQueue workQueue;

    @AfterEach
    void cleanUp() {
        extractionRepository.deleteAll();
        jobRepository.deleteAll();
        documentRepository.deleteAll();
    }

    @Test
    void claimMovesPendingJobToProcessingOnce() {
        final ExtractionJob job = pendingJob(3);

        final Optional<ClaimedJob> claim = jobStore.claim(job.getId());

        assertThat(claim).isPresent();
        assertThat(claim.get().attempt()).isEqualTo(1);
        final ExtractionJob stored = reload(job);
        assertThat(stored.getStatus()).isEqualTo(JobStatus.PROCESSING);
        assertThat(stored.getAttemptToken()).isEqualTo(claim.get().token());
        assertThat(stored.getHeartbeatAt()).isNotNull();
        assertThat(document(job).getStatus()).isEqualTo(DocumentStatus.PROCESSING);
        assertThat(jobStore.claim(job.getId())).isEmpty();
    }

    @Test
    void concurrentClaimsHaveExactlyOneWinner() throws Exception {
        final ExtractionJob job = pendingJob(3);
        final int contenders = 8;
        final CountDownLatch start = new CountDownLatch(1);
        final ExecutorService pool = Executors.newFixedThreadPool(contenders);
        try {
            final List<Future<Optional<ClaimedJob>>> results = new ArrayList<>();
            for (int i = 0; i < contenders; i++) {
                results.add(pool.submit((Callable<Optional<ClaimedJob>>) () -> {
                    start.await();
                    return jobStore.claim(job.getId());
                }));
            }
            start.countDown();

            int winners = 0;
            int conflicts = 0;
            for (final Future<Optional<ClaimedJob>> result : results) {
                try {
                    if (result.get(30, TimeUnit.SECONDS).isPresent()) {
                        winners++;
                    }
                } catch (final ExecutionException e) {
                    conflicts++;
                }
            }
            assertThat(winners).isEqualTo(1);
            assertThat(conflicts).isLessThan(contenders);
            assertThat(reload(job).getAttempts()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void progressIsMonotonicAndTokenGuarded() {
        final ExtractionJob job = pendingJob(3);
        final ClaimedJob claim = jobStore.claim(job.getId()).orElseThrow();

        assertThat(jobStore.updateProgress(job.getId(), claim.token(), 40.0)).isTrue();
        assertThat(jobStore.updateProgress(job.getId(), claim.token(), 30.0)).isFalse();
        assertThat(jobStore.updateProgress(job.getId(), UUID.randomUUID(), 90.0)).isFalse();
        assertThat(jobStore.updateProgress(job.getId(), null, 90.0)).isFalse();
        assertThat(jobStore.updateProgress(job.getId(), claim.token(), Double.NaN)).isFalse();
        assertThat(reload(job).getProgress()).isEqualTo(40.0);

        assertThat(jobStore.updateProgress(job.getId(), claim.token(), 150.0)).isTrue();
        assertThat(reload(job).getProgress()).isEqualTo(100.0);
    }

    @Test
    void progressOnPendingJobIsIgnored() {
        final ExtractionJob job = pendingJob(3);

        assertThat(jobStore.updateProgress(job.getId(), UUID.randomUUID(), 10.0)).isFalse();
        assertThat(reload(job).getProgress()).isZero();
    }

    @Test
    void completionStoresOneExtractionAndWinsOnce() {
        final ExtractionJob job = pendingJob(3);
        final ClaimedJob claim = jobStore.claim(job.getId()).orElseThrow();
        final PipelineResult result = new PipelineResult(Map.of("invoice_number", "INV-1"), 0.87, "invoice",
                                                         Map.of("valid", true));

        assertThat(jobStore.finalizeCompleted(job.getId(), claim.token(), result, 1)).isTrue();
        assertThat(jobStore.finalizeCompleted(job.getId(), claim.token(), result, 1)).isFalse();
        assertThat(jobStore.finalizeFailed(job.getId(), claim.token(), "late failure", 0)).isFalse();

        final ExtractionJob stored = reload(job);
        assertThat(stored.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(stored.getProgress()).isEqualTo(100.0);
        assertThat(stored.getActiveDocumentId()).isNull();
        assertThat(stored.getAttemptToken()).isNull();
        assertThat(stored.getRetryCount()).isEqualTo(1);
        assertThat(stored.getCompletedAt()).isNotNull();
        assertThat(stored.getError()).isNull();

        final Extraction extraction = extractionRepository.findByJobId(job.getId()).orElseThrow();
        assertThat(extraction.getId()).isEqualTo(Extraction.idForJob(job.getId()));
        assertThat(extraction.getExtractedData()).containsEntry("invoice_number", "INV-1");
        assertThat(extraction.getValidationResults()).containsEntry("valid", true);
        assertThat(extractionRepository.count()).isEqualTo(1);
        assertThat(document(job).getStatus()).isEqualTo(DocumentStatus.PROCESSED);
    }

    @Test
    void failureRecordsTheErrorWithoutExtraction() {
        final ExtractionJob job = pendingJob(3);
        final ClaimedJob claim = jobStore.claim(job.getId()).orElseThrow();
        jobStore.updateProgress(job.getId(), claim.token(), 30.0);

        assertThat(jobStore.finalizeFailed(job.getId(), claim.token(), "parse: permanent: corrupt_file", 0)).isTrue();

        final ExtractionJob stored = reload(job);
        assertThat(stored.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(stored.getError()).isEqualTo("parse: permanent: corrupt_file");
        assertThat(stored.getProgress()).isEqualTo(30.0);
        assertThat(extractionRepository.existsByJobId(job.getId())).isFalse();
        final Document document = document(job);
        assertThat(document.getStatus()).isEqualTo(DocumentStatus.ERROR);
        assertThat(document.getError()).isEqualTo("parse: permanent: corrupt_file");
    }

    @Test
    void canceledPendingJobCannotBeClaimedAndFreesTheDocument() {
        final ExtractionJob job = pendingJob(3);

        assertThat(jobStore.cancelPending(job.getId())).isTrue();
        assertThat(jobStore.claim(job.getId())).isEmpty();

        final ExtractionJob stored = reload(job);
        assertThat(stored.getStatus()).isEqualTo(JobStatus.CANCELED);
        assertThat(stored.getActiveDocumentId()).isNull();
        assertThat(stored.getError()).isNull();
        assertThat(jobRepository.existsByActiveDocumentId(job.getDocumentId())).isFalse();
    }

    @Test
    void cancelLosingToClaimEndsCanceledThroughTheFlag() {
        final ExtractionJob job = pendingJob(3);
        final ClaimedJob claim = jobStore.claim(job.getId()).orElseThrow();

        assertThat(jobStore.cancelPending(job.getId())).isFalse();
        assertThat(jobStore.requestCancel(job.getId())).isTrue();
        assertThat(jobStore.checkpoint(job.getId(), claim.token())).isEqualTo(CheckpointResult.CANCEL_REQUESTED);
        assertThat(jobStore.finalizeCanceled(job.getId(), claim.token(), 0)).isTrue();

        final ExtractionJob stored = reload(job);
        assertThat(stored.getStatus()).isEqualTo(JobStatus.CANCELED);
        assertThat(stored.getError()).isNull();
        assertThat(extractionRepository.existsByJobId(job.getId())).isFalse();
        assertThat(document(job).getStatus()).isEqualTo(DocumentStatus.UPLOADED);
        assertThat(jobStore.requestCancel(job.getId())).isFalse();
    }

    @Test
    void watchdogRevokesStaleClaimAndRequeues() {
        final ExtractionJob job = pendingJob(3);
        final ClaimedJob stale = jobStore.claim(job.getId()).orElseThrow();
        ageHeartbeat(job);

        final List<ExtractionJob> staleJobs = jobStore.findStaleProcessing(LocalDateTime.now().minusMinutes(2));
        assertThat(staleJobs).extracting(ExtractionJob::getId).containsExactly(job.getId());
        assertThat(jobStore.recoverStale(staleJobs.get(0), LocalDateTime.now().minusMinutes(2)))
                .isEqualTo(StaleJobOutcome.REQUEUED);
        verify(workQueue).enqueue(job.getId());

        assertThat(jobStore.checkpoint(job.getId(), stale.token())).isEqualTo(CheckpointResult.CLAIM_LOST);
        assertThat(jobStore.updateProgress(job.getId(), stale.token(), 50.0)).isFalse();

        final ClaimedJob takeover = jobStore.claim(job.getId()).orElseThrow();
        assertThat(takeover.attempt()).isEqualTo(2);
        assertThat(takeover.token()).isNotEqualTo(stale.token());
        assertThat(jobStore.finalizeFailed(job.getId(), stale.token(), "stale worker", 0)).isFalse();
        assertThat(reload(job).getStatus()).isEqualTo(JobStatus.PROCESSING);
    }

    @Test
    void watchdogFailsJobWithWorkerLostOnceAttemptsAreUsed() {
        final ExtractionJob job = pendingJob(1);
        jobStore.claim(job.getId()).orElseThrow();
        ageHeartbeat(job);

        assertThat(jobStore.recoverStale(reload(job), LocalDateTime.now().minusMinutes(2)))
                .isEqualTo(StaleJobOutcome.FAILED);

        final ExtractionJob stored = reload(job);
        assertThat(stored.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(stored.getError()).isEqualTo(JobStore.WORKER_LOST);
        assertThat(stored.getActiveDocumentId()).isNull();
        assertThat(document(job).getStatus()).isEqualTo(DocumentStatus.ERROR);
    }

    @Test
    void watchdogCancelsStaleJobWithPendingCancellation() {
        final ExtractionJob job = pendingJob(3);
        jobStore.claim(job.getId()).orElseThrow();
        jobStore.requestCancel(job.getId());
        ageHeartbeat(job);

        assertThat(jobStore.recoverStale(reload(job), LocalDateTime.now().minusMinutes(2)))
                .isEqualTo(StaleJobOutcome.CANCELED);
        assertThat(reload(job).getStatus()).isEqualTo(JobStatus.CANCELED);
    }

    @Test
    void watchdogLeavesJobWithFreshHeartbeat() {
        final ExtractionJob job = pendingJob(3);
        final ClaimedJob claim = jobStore.claim(job.getId()).orElseThrow();
        final ExtractionJob snapshot = reload(job);

        assertThat(jobStore.recoverStale(snapshot, LocalDateTime.now().minusMinutes(2)))
                .isEqualTo(StaleJobOutcome.UNCHANGED);
        assertThat(jobStore.checkpoint(job.getId(), claim.token())).isEqualTo(CheckpointResult.CONTINUE);
    }

    @Test
    void pendingJobIsRequeuedAtMostOncePerThresholdWindow() throws InterruptedException {
        final ExtractionJob job = pendingJob(3);
        Thread.sleep(10);
        final LocalDateTime firstTick = LocalDateTime.now().truncatedTo(ChronoUnit.MILLIS);

        assertThat(jobStore.findPendingUntouchedSince(firstTick)).extracting(ExtractionJob::getId)
                                                                 .containsExactly(job.getId());
        assertThat(jobStore.requeuePending(job.getId(), firstTick)).isTrue();

        // A second pass before the window has elapsed finds nothing to do.
        assertThat(jobStore.findPendingUntouchedSince(firstTick)).isEmpty();
        assertThat(jobStore.requeuePending(job.getId(), firstTick)).isFalse();
        verify(workQueue, times(1)).enqueue(job.getId());

        Thread.sleep(10);
        assertThat(jobStore.requeuePending(job.getId(), LocalDateTime.now())).isTrue();
        verify(workQueue, times(2)).enqueue(job.getId());
    }

    @Test
    void claimedJobIsNotRequeuedAsPending() throws InterruptedException {
        final ExtractionJob job = pendingJob(3);
        jobStore.claim(job.getId()).orElseThrow();
        Thread.sleep(10);

        assertThat(jobStore.findPendingUntouchedSince(LocalDateTime.now())).isEmpty();
        assertThat(jobStore.requeuePending(job.getId(), LocalDateTime.now())).isFalse();
        verify(workQueue, never()).enqueue(job.getId());
    }

    @Test
    void jobRowKeepsItsDocumentReference() {
        final ExtractionJob job = pendingJob(3);

        assertThat(jobRepository.count()).isEqualTo(1);
        assertThat(jobRepository.findByDocumentIdOrderByCreatedAtDesc(job.getDocumentId()))
                .extracting(ExtractionJob::getId).containsExactly(job.getId());
        assertThat(jobRepository.existsByActiveDocumentId(job.getDocumentId())).isTrue();
    }

    private ExtractionJob pendingJob(final int maxAttempts) {
        final Document document = new Document();
        document.setId(UUID.randomUUID());
        document.setFilename("invoice.xlsx");
        document.setDeclaredType("xlsx");
        document.setFileSize(1024);
        document.setStorageRef("documents/invoice.xlsx");
        document.setUploadedAt(LocalDateTime.now());
        documentRepository.save(document);

        final ExtractionJob job = new ExtractionJob();
        job.setId(UUID.randomUUID());
        job.setDocumentId(document.getId());
        job.setActiveDocumentId(document.getId());
        job.setStatus(JobStatus.PENDING);
        job.setMaxAttempts(maxAttempts);
        return jobRepository.saveAndFlush(job);
    }

    private void ageHeartbeat(final ExtractionJob job) {
        final ExtractionJob stored = reload(job);
        stored.setHeartbeatAt(LocalDateTime.now().minusMinutes(10));
        jobRepository.saveAndFlush(stored);
    }

    private ExtractionJob reload(final ExtractionJob job) {
        return jobRepository.findById(job.getId()).orElseThrow();
    }

    private Document document(final ExtractionJob job) {
        return documentRepository.findById(job.getDocumentId()).orElseThrow();
    }
}
