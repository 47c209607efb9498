package com.koni.energy.infrastructure.storage;

import com.koni.energy.application.port.BatchContentSource;
import com.koni.energy.application.port.BatchContentStore;
import com.koni.energy.domain.exception.BatchFetchException;
import com.koni.energy.domain.exception.BatchStoreException;
import com.koni.energy.infrastructure.config.EnergyPipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * BatchContentSource reading batches from a local directory, and BatchContentStore writing
 * simulated batches into it.
 *
 * Locators are either paths relative to {@code energy.storage.base-dir} or {@code file:} URIs
 * pointing inside it. Locators resolving outside the base directory are rejected.
 */
@Slf4j
@Component
public class LocalBatchContentSource implements BatchContentSource, BatchContentStore {

    private static final String FILE_SCHEME = "file:";

    private final Path baseDir;

    public LocalBatchContentSource(EnergyPipelineProperties properties) {
        this.baseDir = Paths.get(properties.getStorage().getBaseDir()).toAbsolutePath().normalize();
        log.info("Local batch content source reading from {}", baseDir);
    }

    @Override
    public String fetch(String batchLocator) {
        Path path = resolve(batchLocator);
        try {
            String content = Files.readString(path, StandardCharsets.UTF_8);
            log.debug("Batch contents read: batchLocator={}, path={}, bytes={}", batchLocator, path, content.length());
            return content;
        } catch (NoSuchFileException e) {
            throw new BatchFetchException(batchLocator, "batch not found: " + path, e);
        } catch (IOException e) {
            throw new BatchFetchException(batchLocator, "batch could not be read: " + e.getMessage(), e);
        }
    }

    @Override
    public String store(String batchName, String content) {
        Path path;
        try {
            path = resolve(batchName);
        } catch (BatchFetchException e) {
            throw new BatchStoreException(batchName, e.getMessage(), e);
        }
        try {
            Files.createDirectories(path.getParent());
            Files.writeString(path, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new BatchStoreException(batchName, "batch could not be written: " + e.getMessage(), e);
        }
        log.info("Batch contents written: batchLocator={}, path={}, bytes={}", batchName, path, content.length());
        return batchName;
    }

    Path resolve(String batchLocator) {
        if (batchLocator == null || batchLocator.isBlank()) {
            throw new BatchFetchException(batchLocator, "batch locator is empty");
        }
        Path candidate;
        try {
            if (batchLocator.startsWith(FILE_SCHEME)) {
                candidate = Paths.get(URI.create(batchLocator));
            } else {
                candidate = baseDir.resolve(batchLocator);
            }
        } catch (IllegalArgumentException e) {
            throw new BatchFetchException(batchLocator, "batch locator is not a valid path: " + e.getMessage(), e);
        }
        Path normalized = candidate.toAbsolutePath().normalize();
        if (!normalized.startsWith(baseDir)) {
            throw new BatchFetchException(batchLocator, "batch locator resolves outside " + baseDir);
        }
        return normalized;
    }
}
