package com.eyelevel.sheetextractor.scheduler;

import com.eyelevel.sheetextractor.config.ExtractionEngineConfig;
import com.eyelevel.sheetextractor.queue.WorkQueue;
import com.eyelevel.sheetextractor.store.ClaimedJob;
import com.eyelevel.sheetextractor.store.JobStore;
import com.eyelevel.sheetextractor.worker.InFlightJobs;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Keeps the jobs running in this process alive: refreshes each job's heartbeat under its claim token and
 * extends the visibility of the queue message that delivered it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkerHeartbeatScheduler {

    private final InFlightJobs inFlightJobs;
    private final JobStore jobStore;
    private final WorkQueue workQueue;
    private final ExtractionEngineConfig engineConfig;

    @Scheduled(fixedDelayString = "${app.worker.heartbeat-interval:PT10S}")
    public void beat() {
        if (inFlightJobs.isEmpty()) {
            return;
        }
        for (final InFlightJobs.InFlightJob job : inFlightJobs.snapshot()) {
            final ClaimedJob claim = job.claim();
            try {
                if (!jobStore.heartbeat(claim.jobId(), claim.token())) {
                    log.warn("[{}] Heartbeat rejected for token {}. The pipeline stops at its next checkpoint.",
                             claim.jobId(), claim.token());
                    continue;
                }
                workQueue.extendVisibility(job.ackHandle(), engineConfig.getQueue().getVisibilityTimeout());
            } catch (final RuntimeException e) {
                log.warn("[{}] Heartbeat failed: {}", claim.jobId(), e.getMessage());
            }
        }
    }
}
