package com.example.shorts_backend.service;

import com.example.shorts_backend.exception.StorageException;
import com.example.shorts_backend.model.Job;
import com.example.shorts_backend.model.Segment;
import com.example.shorts_backend.service.Interfaces.StorageService;
import com.example.shorts_backend.util.JobStage;
import com.example.shorts_backend.util.YoutubeUrls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Set;
import java.util.UUID;

@Service
public class JobService {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobService.class);

    public static final Set<Integer> ALLOWED_DURATIONS = Set.of(30, 60, 90, 120, 180);
    public static final Set<Integer> ALLOWED_CLIP_COUNTS = Set.of(5, 10, 15);
    public static final int DEFAULT_DURATION = 60;
    public static final int DEFAULT_CLIP_COUNT = 5;

    private final JobStore jobStore;
    private final WorkerService workerService;
    private final StorageService storage;
    private final Clock clock;

    public JobService(JobStore jobStore, WorkerService workerService, StorageService storage, Clock clock) {
        this.jobStore = jobStore;
        this.workerService = workerService;
        this.storage = storage;
        this.clock = clock;
    }

    /**
     * Validates the request, stores a {@code QUEUED} job and hands it to the worker.
     *
     * @throws ResponseStatusException 400 with {@code URL_INVALID}, {@code DURATION_INVALID} or
     *                                 {@code CLIP_COUNT_INVALID}.
     */
    public Job submit(String url, Integer durationSec, Integer clipCount) {
        String trimmed = url == null ? null : url.trim();
        String videoId = YoutubeUrls.extractVideoId(trimmed)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "URL_INVALID"));
        int duration = durationSec == null ? DEFAULT_DURATION : durationSec;
        if (!ALLOWED_DURATIONS.contains(duration)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "DURATION_INVALID");
        }
        int count = clipCount == null ? DEFAULT_CLIP_COUNT : clipCount;
        if (!ALLOWED_CLIP_COUNTS.contains(count)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "CLIP_COUNT_INVALID");
        }

        Job job = Job.queued(UUID.randomUUID(), trimmed, videoId, duration, count, clock.instant());
        jobStore.insert(job);
        LOGGER.info("JOB QUEUED jobId={} videoId={} clipDuration={}s clipCount={}", job.id(), videoId, duration, count);
        workerService.submit(job.id());
        return jobStore.get(job.id()).orElse(job);
    }

    public Job get(UUID id) {
        return jobStore.get(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND"));
    }

    /**
     * Removes a finished job with its clips right away. An active job is only flagged; its worker
     * removes it at the next stage boundary.
     *
     * @return true when the job is gone already, false when cancellation is pending.
     */
    public boolean delete(UUID id) {
        Job job = get(id);
        // false when the worker finished in between
        if (!job.isTerminal() && jobStore.requestCancel(id)) {
            LOGGER.info("JOB CANCEL REQUESTED jobId={} stage={}", id, job.stage());
            return false;
        }
        jobStore.remove(id);
        deleteOutputs(id);
        LOGGER.info("JOB DELETED jobId={}", id);
        return true;
    }

    /**
     * @throws ResponseStatusException 409 {@code JOB_NOT_COMPLETED} before completion, 404
     *                                 {@code CLIP_NOT_FOUND} when no rendered clip has that index.
     */
    public Path clipFile(UUID id, int index) {
        Job job = get(id);
        if (job.stage() != JobStage.COMPLETED) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "JOB_NOT_COMPLETED");
        }
        Segment segment = job.segments().stream()
                .filter(s -> s.index() == index && s.rendered())
                .findFirst()
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "CLIP_NOT_FOUND"));
        if (!Files.exists(segment.output())) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "CLIP_NOT_FOUND");
        }
        return segment.output();
    }

    private void deleteOutputs(UUID id) {
        try {
            storage.deleteOutputs(id);
        } catch (StorageException e) {
            LOGGER.warn("JOB DELETE cleanup failed jobId={} err={}", id, e.toString());
        }
    }
}
