package com.example.shorts_backend.service;

import com.example.shorts_backend.exception.StorageException;
import com.example.shorts_backend.service.Interfaces.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

public class LocalStorageService implements StorageService {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalStorageService.class);

    private final Path baseDir;
    private final Path downloadsDir;
    private final Path outputsDir;

    public LocalStorageService(Path baseDir, String downloadsPrefix, String outputsPrefix) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.downloadsDir = this.baseDir.resolve(downloadsPrefix).normalize();
        this.outputsDir = this.baseDir.resolve(outputsPrefix).normalize();

        try {
            Files.createDirectories(downloadsDir);
            Files.createDirectories(outputsDir);
            LOGGER.info("LocalStorageService ready. base={}, downloads={}, outputs={}", this.baseDir, this.downloadsDir, this.outputsDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage directories", e);
        }
    }

    @Override
    public Path resolveDownload(String objectKey) {
        return safeResolve(downloadsDir, objectKey);
    }

    @Override
    public Path resolveOutput(UUID jobId, String fileName) {
        return safeResolve(outputDir(jobId), fileName);
    }

    @Override
    public Path outputDir(UUID jobId) {
        if (jobId == null) {
            throw new StorageException("jobId is null");
        }
        return safeResolve(outputsDir, jobId.toString());
    }

    @Override
    public boolean existsDownload(String objectKey) {
        return Files.exists(safeResolve(downloadsDir, objectKey));
    }

    @Override
    public void deleteDownload(String objectKey) {
        Path p = safeResolve(downloadsDir, objectKey);
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            throw new StorageException("Delete failed: " + p, e);
        }
    }

    @Override
    public void deleteOutputs(UUID jobId) {
        deleteRecursively(outputDir(jobId));
    }

    @Override
    public Path rootDownloads() {
        return downloadsDir;
    }

    @Override
    public Path rootOutputs() {
        return outputsDir;
    }

    private Path safeResolve(Path root, String objectKey) {
        if (objectKey == null || objectKey.isBlank()) {
            throw new StorageException("objectKey is blank");
        }
        // Force forward slashes; strip leading slashes
        String normalizedKey = objectKey.replace('\\', '/').replaceAll("^/+", "");
        Path p = root.resolve(normalizedKey).normalize();
        if (!p.startsWith(root) || p.equals(root)) {
            throw new StorageException("Invalid objectKey (path traversal?): " + objectKey);
        }
        return p;
    }

    private void deleteRecursively(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(dir)) {
            paths = walk.sorted(Comparator.reverseOrder()).toList();
        } catch (IOException e) {
            throw new StorageException("Listing failed: " + dir, e);
        }
        for (Path p : paths) {
            try {
                Files.deleteIfExists(p);
            } catch (IOException e) {
                throw new StorageException("Delete failed: " + p, e);
            }
        }
    }
}
