package com.eyelevel.sheetextractor.scheduler;

import com.eyelevel.sheetextractor.config.ExtractionEngineConfig;
import com.eyelevel.sheetextractor.model.ExtractionJob;
import com.eyelevel.sheetextractor.store.JobStore;
import com.eyelevel.sheetextractor.store.StaleJobOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobWatchdogSchedulerTest {

    @Mock
    private JobStore jobStore;

    private JobWatchdogScheduler watchdog;

    @BeforeEach
    void setUp() {
        watchdog = new JobWatchdogScheduler(jobStore, new ExtractionEngineConfig());
    }

    @Test
    void countsStaleJobOutcomesAndSurvivesFailures() {
        final ExtractionJob requeued = job();
        final ExtractionJob lost = job();
        final ExtractionJob broken = job();
        when(jobStore.findStaleProcessing(any())).thenReturn(List.of(requeued, lost, broken));
        when(jobStore.recoverStale(eq(requeued), any())).thenReturn(StaleJobOutcome.REQUEUED);
        when(jobStore.recoverStale(eq(lost), any())).thenReturn(StaleJobOutcome.FAILED);
        when(jobStore.recoverStale(eq(broken), any())).thenThrow(new IllegalStateException("boom"));

        final Map<StaleJobOutcome, Integer> outcomes = watchdog.recoverStaleJobs();

        assertThat(outcomes).containsEntry(StaleJobOutcome.REQUEUED, 1).containsEntry(StaleJobOutcome.FAILED, 1)
                            .hasSize(2);
    }

    @Test
    void staleCutoffUsesTheConfiguredThreshold() {
        when(jobStore.findStaleProcessing(any())).thenAnswer(invocation -> {
            final LocalDateTime cutoff = invocation.getArgument(0);
            assertThat(cutoff).isBefore(LocalDateTime.now().minusSeconds(119))
                              .isAfter(LocalDateTime.now().minusSeconds(130));
            return List.of();
        });

        assertThat(watchdog.recoverStaleJobs()).isEmpty();
    }

    @Test
    void requeuesOldPendingJobsAndSurvivesFailures() {
        final ExtractionJob first = job();
        final ExtractionJob second = job();
        final ExtractionJob alreadyRequeued = job();
        when(jobStore.findPendingUntouchedSince(any())).thenReturn(List.of(first, second, alreadyRequeued));
        when(jobStore.requeuePending(eq(first.getId()), any())).thenReturn(true);
        when(jobStore.requeuePending(eq(second.getId()), any())).thenThrow(new IllegalStateException("db down"));
        when(jobStore.requeuePending(eq(alreadyRequeued.getId()), any())).thenReturn(false);

        assertThat(watchdog.requeueOldPendingJobs()).isEqualTo(1);
        verify(jobStore).requeuePending(eq(second.getId()), any());
    }

    @Test
    void pendingRequeueThresholdIsTheConfiguredOne() {
        when(jobStore.findPendingUntouchedSince(any())).thenAnswer(invocation -> {
            final LocalDateTime threshold = invocation.getArgument(0);
            assertThat(threshold).isBefore(LocalDateTime.now().minusMinutes(4))
                                 .isAfter(LocalDateTime.now().minusMinutes(6));
            return List.of();
        });

        assertThat(watchdog.requeueOldPendingJobs()).isZero();
        verify(jobStore, never()).requeuePending(any(), any());
    }

    private static ExtractionJob job() {
        final ExtractionJob job = new ExtractionJob();
        job.setId(UUID.randomUUID());
        job.setDocumentId(UUID.randomUUID());
        return job;
    }
}
