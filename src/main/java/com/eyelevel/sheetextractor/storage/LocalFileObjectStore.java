package com.eyelevel.sheetextractor.storage;

import com.eyelevel.sheetextractor.config.ExtractionEngineConfig;
import com.eyelevel.sheetextractor.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * {@link ObjectStore} reading from a directory on the local file system, for local runs and tests.
 * Storage refs are paths relative to {@code app.storage.local-root} and may not escape it.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.storage.type", havingValue = "local")
public class LocalFileObjectStore implements ObjectStore {

    private final Path root;

    public LocalFileObjectStore(final ExtractionEngineConfig engineConfig) {
        final String localRoot = engineConfig.getStorage().getLocalRoot();
        if (localRoot == null || localRoot.isBlank()) {
            throw new IllegalArgumentException("app.storage.local-root must be set when app.storage.type=local");
        }
        this.root = Paths.get(localRoot).toAbsolutePath().normalize();
        log.info("Local object store rooted at {}", root);
    }

    @Override
    public InputStream get(final String storageRef) {
        final String normalized = FilenameUtils.normalize(storageRef, true);
        if (normalized == null) {
            throw new StorageException("Storage ref escapes the storage root: " + storageRef);
        }
        final Path path = root.resolve(normalized).normalize();
        if (!path.startsWith(root)) {
            throw new StorageException("Storage ref escapes the storage root: " + storageRef);
        }
        try {
            return Files.newInputStream(path);
        } catch (final NoSuchFileException e) {
            throw new StorageException("Object not found: " + storageRef, e);
        } catch (final IOException e) {
            throw new StorageException("Failed to read " + storageRef, e);
        }
    }
}
