package com.eyelevel.sheetextractor.worker;

import com.eyelevel.sheetextractor.config.ExtractionEngineConfig;
import com.eyelevel.sheetextractor.queue.QueueMessage;
import com.eyelevel.sheetextractor.queue.WorkQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Runs {@code app.worker.concurrency} dequeue loops on the worker executor for the lifetime of the
 * application context. A loop survives any exception thrown while handling a message.
 */
@Slf4j
@Component
public class WorkerPool implements SmartLifecycle {

    private final WorkQueue workQueue;
    private final JobProcessor jobProcessor;
    private final ThreadPoolTaskExecutor workerExecutor;
    private final ExtractionEngineConfig.Worker workerConfig;

    private volatile boolean running;

    public WorkerPool(final WorkQueue workQueue, final JobProcessor jobProcessor,
                      @Qualifier("workerExecutor") final ThreadPoolTaskExecutor workerExecutor,
                      final ExtractionEngineConfig engineConfig) {
        this.workQueue = workQueue;
        this.jobProcessor = jobProcessor;
        this.workerExecutor = workerExecutor;
        this.workerConfig = engineConfig.getWorker();
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        running = true;
        final int concurrency = Math.max(1, workerConfig.getConcurrency());
        for (int i = 0; i < concurrency; i++) {
            workerExecutor.execute(this::loop);
        }
        log.info("Worker pool started with {} loops.", concurrency);
    }

    @Override
    public void stop() {
        running = false;
        log.info("Worker pool stopping. Loops exit after their current message.");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return workerConfig.isEnabled();
    }

    private void loop() {
        log.debug("Worker loop started.");
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                final Optional<QueueMessage> message = workQueue.dequeue(workerConfig.getDequeueTimeout());
                if (message.isPresent()) {
                    jobProcessor.process(message.get());
                }
            } catch (final RuntimeException e) {
                log.error("Worker loop error. Backing off for {}.", workerConfig.getIdleBackoff(), e);
                if (!pause(workerConfig.getIdleBackoff())) {
                    break;
                }
            }
        }
        log.debug("Worker loop exited.");
    }

    private static boolean pause(final Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
