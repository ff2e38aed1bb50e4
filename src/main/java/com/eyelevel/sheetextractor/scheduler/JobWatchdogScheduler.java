package com.eyelevel.sheetextractor.scheduler;

import com.eyelevel.sheetextractor.config.ExtractionEngineConfig;
import com.eyelevel.sheetextractor.model.ExtractionJob;
import com.eyelevel.sheetextractor.store.JobStore;
import com.eyelevel.sheetextractor.store.StaleJobOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Periodically recovers jobs whose worker went away and PENDING jobs whose queue message was lost.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobWatchdogScheduler {

    private final JobStore jobStore;
    private final ExtractionEngineConfig engineConfig;

    @Scheduled(cron = "${app.scheduler.watchdog}")
    public void run() {
        recoverStaleJobs();
        requeueOldPendingJobs();
    }

    /**
     * Resolves PROCESSING jobs without a heartbeat newer than the stale threshold.
     *
     * @return How many jobs ended in each outcome.
     */
    public Map<StaleJobOutcome, Integer> recoverStaleJobs() {
        final LocalDateTime staleBefore = LocalDateTime.now().minus(engineConfig.getWatchdog().getStaleThreshold());
        final List<ExtractionJob> staleJobs = jobStore.findStaleProcessing(staleBefore);
        final Map<StaleJobOutcome, Integer> outcomes = new EnumMap<>(StaleJobOutcome.class);
        if (staleJobs.isEmpty()) {
            return outcomes;
        }

        log.warn("Found {} PROCESSING jobs without a heartbeat since {}.", staleJobs.size(), staleBefore);
        for (final ExtractionJob job : staleJobs) {
            try {
                outcomes.merge(jobStore.recoverStale(job, staleBefore), 1, Integer::sum);
            } catch (final RuntimeException e) {
                log.error("[{}] Failed to recover stale job.", job.getId(), e);
            }
        }
        log.info("Stale job recovery finished: {}", outcomes);
        return outcomes;
    }

    /**
     * Re-enqueues PENDING jobs untouched for longer than the requeue threshold. Each job is stamped when it
     * is re-enqueued, so a job still waiting in a backlog gets at most one extra message per threshold.
     * Duplicate deliveries are absorbed by the claim.
     *
     * @return The number of jobs re-enqueued.
     */
    public int requeueOldPendingJobs() {
        final LocalDateTime threshold =
                LocalDateTime.now().minus(engineConfig.getWatchdog().getPendingRequeueThreshold());
        int requeued = 0;
        for (final ExtractionJob job : jobStore.findPendingUntouchedSince(threshold)) {
            try {
                if (jobStore.requeuePending(job.getId(), threshold)) {
                    requeued++;
                }
            } catch (final RuntimeException e) {
                log.error("[{}] Failed to re-enqueue PENDING job.", job.getId(), e);
            }
        }
        if (requeued > 0) {
            log.warn("Re-enqueued {} PENDING jobs untouched since {}.", requeued, threshold);
        }
        return requeued;
    }
}
