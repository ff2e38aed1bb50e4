package com.eyelevel.sheetextractor.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryMode;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;

/**
 * Configures the AWS SDK clients backing the S3 object store and the SQS work queue.
 * <p>
 * The credential strategy depends on the active Spring profile. Each client is only created when the
 * matching adapter is selected, so local runs with {@code app.queue.type=memory} and
 * {@code app.storage.type=local} need no AWS setup at all.
 */
@Slf4j
@Configuration
@ConditionalOnExpression("'${app.queue.type:sqs}' == 'sqs' or '${app.storage.type:s3}' == 's3'")
public class AwsConfig {

    @Value("${aws.region}")
    private String awsRegion;

    @Value("${aws.access-key:}")
    private String accessKey;

    @Value("${aws.secret-key:}")
    private String secretKey;

    @Value("${aws.s3.retry-count:4}")
    private int s3RetryCount;

    /**
     * Determines which credentials provider to use based on the active Spring profile.
     */
    @Bean
    public AwsCredentialsProvider awsCredentialsProvider(Environment environment) {
        if (environment.acceptsProfiles(Profiles.of("local"))) {
            log.info("Local profile active. Using StaticCredentialsProvider.");
            if (!StringUtils.hasText(accessKey) || !StringUtils.hasText(secretKey)) {
                throw new IllegalArgumentException(
                        "aws.access-key and aws.secret-key must be set for the 'local' profile.");
            }
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey));
        }
        log.info("Non-local profile active. Using DefaultCredentialsProvider (for IAM role).");
        return DefaultCredentialsProvider.create();
    }

    /**
     * Creates the synchronous S3Client used to stream document bytes, with an adaptive retry policy.
     */
    @Bean
    @ConditionalOnProperty(name = "app.storage.type", havingValue = "s3", matchIfMissing = true)
    public S3Client s3Client(AwsCredentialsProvider credentialsProvider) {
        log.info("Configuring AWS S3Client for region: {} with {} retries", awsRegion, s3RetryCount);
        RetryPolicy adaptiveRetryPolicy = RetryPolicy.forRetryMode(RetryMode.ADAPTIVE).toBuilder()
                                                     .numRetries(s3RetryCount).build();
        return S3Client.builder().credentialsProvider(credentialsProvider).region(Region.of(awsRegion))
                       .overrideConfiguration(ClientOverrideConfiguration.builder()
                                                                         .retryPolicy(adaptiveRetryPolicy).build())
                       .build();
    }

    /**
     * Creates the SQS async client used for long-poll receives, deletes and visibility changes.
     */
    @Bean
    @ConditionalOnProperty(name = "app.queue.type", havingValue = "sqs", matchIfMissing = true)
    public SqsAsyncClient sqsAsyncClient(AwsCredentialsProvider credentialsProvider) {
        log.info("Configuring AWS SqsAsyncClient for region: {}", awsRegion);
        return SqsAsyncClient.builder().region(Region.of(awsRegion)).credentialsProvider(credentialsProvider).build();
    }
}
