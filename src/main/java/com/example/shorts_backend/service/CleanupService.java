package com.example.shorts_backend.service;

import com.example.shorts_backend.config.CleanupProperties;
import com.example.shorts_backend.exception.StorageException;
import com.example.shorts_backend.model.Job;
import com.example.shorts_backend.service.Interfaces.StorageService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Time based eviction of finished jobs, rendered clips and downloaded sources. Files that an active
 * job still uses are never touched.
 */
@Service
public class CleanupService {
    private static final Logger LOGGER = LoggerFactory.getLogger(CleanupService.class);

    private final JobStore jobStore;
    private final StorageService storage;
    private final CleanupProperties properties;
    private final Clock clock;

    public CleanupService(JobStore jobStore, StorageService storage, CleanupProperties properties, Clock clock) {
        this.jobStore = jobStore;
        this.storage = storage;
        this.properties = properties;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        sweep(retention());
    }

    @Scheduled(fixedDelayString = "${cleanup.sweep-interval-ms:3600000}", initialDelayString = "${cleanup.sweep-interval-ms:3600000}")
    public void scheduledSweep() {
        sweep(retention());
    }

    @PreDestroy
    public void onShutdown() {
        if (properties.isPurgeOnShutdown()) {
            LOGGER.info("CLEANUP purge on shutdown");
            sweep(Duration.ZERO);
        }
    }

    /**
     * Removes terminal jobs completed at least {@code retention} ago and, when file deletion is
     * enabled, their clips plus downloads and orphaned output directories not modified within
     * {@code retention}.
     */
    public SweepResult sweep(Duration retention) {
        Instant cutoff = clock.instant().minus(retention);
        int jobs = 0;
        for (Job job : jobStore.snapshot()) {
            if (job.isTerminal() && job.completedAt() != null && !job.completedAt().isAfter(cutoff)) {
                jobStore.remove(job.id());
                if (properties.isDeleteFiles()) {
                    deleteOutputs(job.id());
                }
                jobs++;
            }
        }

        int downloads = 0;
        int outputs = 0;
        if (properties.isDeleteFiles()) {
            List<Job> remaining = jobStore.snapshot();
            Set<Path> inUse = new HashSet<>();
            Set<String> knownJobs = new HashSet<>();
            for (Job job : remaining) {
                knownJobs.add(job.id().toString());
                if (!job.isTerminal()) {
                    inUse.add(storage.resolveDownload(job.videoId() + ".mp4").toAbsolutePath().normalize());
                    if (job.mediaPath() != null) {
                        inUse.add(job.mediaPath().toAbsolutePath().normalize());
                    }
                }
            }
            downloads = sweepDownloads(cutoff, inUse);
            outputs = sweepOrphanOutputs(cutoff, knownJobs);
        }

        SweepResult result = new SweepResult(jobs, downloads, outputs);
        LOGGER.info("CLEANUP SWEEP retention={}h jobs={} downloads={} outputDirs={}", retention.toHours(), jobs, downloads, outputs);
        return result;
    }

    private int sweepDownloads(Instant cutoff, Set<Path> inUse) {
        int deleted = 0;
        for (Path file : list(storage.rootDownloads())) {
            Path normalized = file.toAbsolutePath().normalize();
            if (inUse.contains(normalized) || !Files.isRegularFile(file) || !olderThan(file, cutoff)) {
                continue;
            }
            try {
                Files.deleteIfExists(file);
                deleted++;
                LOGGER.info("Deleted old download: {}", file.getFileName());
            } catch (IOException e) {
                LOGGER.warn("Cleanup delete failed path={} err={}", file, e.toString());
            }
        }
        return deleted;
    }

    private int sweepOrphanOutputs(Instant cutoff, Set<String> knownJobs) {
        int deleted = 0;
        for (Path dir : list(storage.rootOutputs())) {
            String name = dir.getFileName().toString();
            if (!Files.isDirectory(dir) || knownJobs.contains(name) || !olderThan(dir, cutoff)) {
                continue;
            }
            UUID jobId;
            try {
                jobId = UUID.fromString(name);
            } catch (IllegalArgumentException e) {
                LOGGER.debug("Cleanup skips foreign directory {}", dir);
                continue;
            }
            if (deleteOutputs(jobId)) {
                deleted++;
                LOGGER.info("Deleted old job directory: {}", name);
            }
        }
        return deleted;
    }

    private boolean deleteOutputs(UUID jobId) {
        try {
            storage.deleteOutputs(jobId);
            return true;
        } catch (StorageException e) {
            LOGGER.warn("Cleanup delete failed jobId={} err={}", jobId, e.toString());
            return false;
        }
    }

    private static boolean olderThan(Path path, Instant cutoff) {
        try {
            return !Files.getLastModifiedTime(path).toInstant().isAfter(cutoff);
        } catch (IOException e) {
            LOGGER.warn("Cleanup cannot stat path={} err={}", path, e.toString());
            return false;
        }
    }

    private static List<Path> list(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> s = Files.list(dir)) {
            return s.toList();
        } catch (IOException e) {
            LOGGER.warn("Cleanup cannot list dir={} err={}", dir, e.toString());
            return List.of();
        }
    }

    private Duration retention() {
        return Duration.ofHours(Math.max(0, properties.getRetentionHours()));
    }

    public record SweepResult(int jobs, int downloads, int outputDirs) { }
}
