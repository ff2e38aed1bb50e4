package com.eyelevel.sheetextractor.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configures the managed thread pools of the extraction engine.
 */
@Configuration
@RequiredArgsConstructor
public class TaskExecutorConfig {

    private final ExtractionEngineConfig engineConfig;

    /**
     * Runs the long-lived worker loops, one thread per loop. Thread names carry the
     * {@code extraction-worker-} prefix so log lines show which loop handled a job.
     *
     * @return The worker pool executor.
     */
    @Bean("workerExecutor")
    public ThreadPoolTaskExecutor workerExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int concurrency = Math.max(1, engineConfig.getWorker().getConcurrency());
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("extraction-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /**
     * Runs individual pipeline stages so a stage can be bounded by its timeout and interrupted.
     *
     * @return The stage executor.
     */
    @Bean("pipelineStageExecutor")
    public ThreadPoolTaskExecutor pipelineStageExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int concurrency = Math.max(1, engineConfig.getWorker().getConcurrency());
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency * 2);
        executor.setQueueCapacity(concurrency * 4);
        executor.setThreadNamePrefix("pipeline-stage-");
        executor.initialize();
        return executor;
    }

    /**
     * Shared pool for AI calls. Per-job concurrency is limited separately by the extractor.
     *
     * @return The AI call executor.
     */
    @Bean("aiCallExecutor")
    public ThreadPoolTaskExecutor aiCallExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int size = Math.max(1, engineConfig.getWorker().getConcurrency())
                   * Math.max(1, engineConfig.getPipeline().getExtract().getMaxConcurrency());
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setQueueCapacity(size * 8);
        executor.setThreadNamePrefix("ai-call-");
        executor.initialize();
        return executor;
    }
}
