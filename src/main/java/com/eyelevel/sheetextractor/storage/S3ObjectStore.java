package com.eyelevel.sheetextractor.storage;

import com.eyelevel.sheetextractor.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;

import java.io.InputStream;

/**
 * {@link ObjectStore} backed by a single S3 bucket. Storage refs are object keys.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.storage.type", havingValue = "s3", matchIfMissing = true)
public class S3ObjectStore implements ObjectStore {

    private final S3Client s3Client;
    private final String bucketName;

    public S3ObjectStore(final S3Client s3Client, @Value("${aws.s3.bucket-name}") final String bucketName) {
        this.s3Client = s3Client;
        this.bucketName = bucketName;
    }

    @Override
    public InputStream get(final String storageRef) {
        log.debug("Downloading object from S3 key: {}", storageRef);
        try {
            return s3Client.getObject(GetObjectRequest.builder().bucket(bucketName).key(storageRef).build());
        } catch (final NoSuchKeyException e) {
            throw new StorageException("Object not found in bucket " + bucketName + ": " + storageRef, e);
        } catch (final SdkException e) {
            throw new StorageException("Failed to download " + storageRef + " from bucket " + bucketName, e);
        }
    }
}
