package com.eyelevel.sheetextractor;

import com.eyelevel.sheetextractor.config.ExtractionEngineConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * The main entry point for the Sheet Extractor Spring Boot application.
 * <p>
 * This class bootstraps the application context and enables key Spring features:
 * <ul>
 *     <li>{@link EnableConfigurationProperties}: Binds the engine properties (prefixed with "app")
 *     to the {@link ExtractionEngineConfig} class.</li>
 *     <li>{@link EnableScheduling}: Activates the heartbeat and watchdog background tasks.</li>
 *     <li>{@link EnableJpaRepositories}: Configures the base package for scanning Spring Data JPA repositories.</li>
 *     <li>{@link EnableRetry}: Backs the bounded retries of AI calls.</li>
 * </ul>
 */
@Slf4j
@EnableScheduling
@SpringBootApplication
@EnableJpaRepositories(basePackages = "com.eyelevel.sheetextractor.repository")
@EnableConfigurationProperties(value = ExtractionEngineConfig.class)
@EnableRetry
public class SheetExtractorApplication {

    /**
     * Launches the application and logs the active environment once the context is up.
     *
     * @param args Command-line arguments passed to the application.
     */
    public static void main(final String[] args) {
        log.info("Starting SheetExtractorApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(SheetExtractorApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "SheetExtractor"));
        log.info("  - Queue:      {}", env.getProperty("app.queue.type", "sqs"));
        log.info("  - Storage:    {}", env.getProperty("app.storage.type", "s3"));
        log.info("  - Workers:    {}", env.getProperty("app.worker.concurrency", "4"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
