package com.eyelevel.sheetextractor.queue;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.UUID;

/**
 * Publishes a job id only once the transaction that made the job claimable has committed, so a worker
 * never receives an id whose row it cannot see yet. A send that fails after the commit is logged; the
 * watchdog re-enqueues PENDING jobs that stay unclaimed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AfterCommitEnqueuer {

    private final WorkQueue workQueue;

    public void enqueueAfterCommit(final UUID jobId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            workQueue.enqueue(jobId);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                try {
                    workQueue.enqueue(jobId);
                    log.info("[{}] Enqueued after commit.", jobId);
                } catch (final RuntimeException e) {
                    log.error("[{}] Enqueue after commit failed. The watchdog will re-enqueue the job.", jobId, e);
                }
            }
        });
    }
}
