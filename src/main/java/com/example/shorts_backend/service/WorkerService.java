package com.example.shorts_backend.service;

import com.example.shorts_backend.config.AnalysisProperties;
import com.example.shorts_backend.config.WorkerExecutorProperties;
import com.example.shorts_backend.dto.RenderOptions;
import com.example.shorts_backend.dto.RenderResult;
import com.example.shorts_backend.dto.analysis.AnalysisRequest;
import com.example.shorts_backend.dto.analysis.AnalyzerResult;
import com.example.shorts_backend.engine.Interfaces.ClipRenderEngine;
import com.example.shorts_backend.engine.Interfaces.MediaFetcher;
import com.example.shorts_backend.engine.Interfaces.MediaSampler;
import com.example.shorts_backend.exception.AnalysisException;
import com.example.shorts_backend.exception.DownloadException;
import com.example.shorts_backend.exception.JobCancelledException;
import com.example.shorts_backend.exception.StorageException;
import com.example.shorts_backend.fusion.EngagementCurve;
import com.example.shorts_backend.fusion.ScoreFusion;
import com.example.shorts_backend.model.Job;
import com.example.shorts_backend.model.JobError;
import com.example.shorts_backend.model.Segment;
import com.example.shorts_backend.selector.SegmentSelector;
import com.example.shorts_backend.selector.SelectorConfig;
import com.example.shorts_backend.service.Interfaces.StorageService;
import com.example.shorts_backend.util.ErrorKind;
import com.example.shorts_backend.util.JobStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives a job through download, analysis, selection and rendering. One task per job runs on the
 * worker pool; a semaphore caps how many pipelines are active at once. Every state change goes
 * through {@link JobStore#update}, so pollers only ever see complete snapshots.
 */
@Service
public class WorkerService {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerService.class);

    static final String MSG_CACHED = "Using cached video, skipping download...";
    static final String MSG_DOWNLOADING = "Downloading video from YouTube...";
    static final String MSG_ANALYZING = "Analyzing video for engaging moments...";
    static final String MSG_PROCESSING = "Extracting and processing clips...";
    static final String MSG_SYSTEM = "An unexpected error occurred while processing the video";
    private static final long LOCK_POLL_MS = 200;

    private final JobStore jobStore;
    private final StorageService storage;
    private final MediaFetcher fetcher;
    private final MediaSampler sampler;
    private final AnalysisService analysisService;
    private final ScoreFusion fusion;
    private final SegmentSelector selector;
    private final ClipRenderEngine renderEngine;
    private final RenderOptions renderOptions;
    private final AnalysisProperties analysisProperties;
    private final Executor workerExecutor;
    private final Semaphore pipelineSemaphore;
    private final Clock clock;
    private final Map<String, DownloadLock> downloadLocks = new ConcurrentHashMap<>();

    public WorkerService(JobStore jobStore,
                         StorageService storage,
                         MediaFetcher fetcher,
                         MediaSampler sampler,
                         AnalysisService analysisService,
                         ScoreFusion fusion,
                         SegmentSelector selector,
                         ClipRenderEngine renderEngine,
                         RenderOptions renderOptions,
                         AnalysisProperties analysisProperties,
                         @Qualifier("workerTaskExecutor") Executor workerExecutor,
                         WorkerExecutorProperties workerProperties,
                         Clock clock) {
        this.jobStore = jobStore;
        this.storage = storage;
        this.fetcher = fetcher;
        this.sampler = sampler;
        this.analysisService = analysisService;
        this.fusion = fusion;
        this.selector = selector;
        this.renderEngine = renderEngine;
        this.renderOptions = renderOptions;
        this.analysisProperties = analysisProperties;
        this.workerExecutor = workerExecutor;
        this.pipelineSemaphore = new Semaphore(Math.max(1, workerProperties.getMaxActivePipelines()));
        this.clock = clock;
    }

    /**
     * Schedules the pipeline of a stored {@code QUEUED} job. A full worker pool fails the job
     * immediately with {@link ErrorKind#SYSTEM}.
     */
    public void submit(UUID jobId) {
        try {
            workerExecutor.execute(() -> runJobWithSemaphore(jobId));
        } catch (RejectedExecutionException e) {
            LOGGER.error("JOB REJECTED jobId={} err={}", jobId, e.toString());
            fail(jobId, new JobError(ErrorKind.SYSTEM, "REJECTED", "Server is busy, please try again later"));
        }
    }

    void runJobWithSemaphore(UUID jobId) {
        boolean acquired = false;
        long t0 = System.nanoTime();
        try {
            pipelineSemaphore.acquire();
            acquired = true;
            Job job = jobStore.get(jobId).orElse(null);
            if (job == null) {
                LOGGER.debug("JOB SKIP jobId={} removed before start", jobId);
                return;
            }
            LOGGER.info("JOB START jobId={} url={} clipDuration={}s clipCount={}", jobId, job.sourceUrl(), job.clipDurationSec(), job.clipCount());
            boolean ok = runJob(job);
            LOGGER.info("JOB {} jobId={} in={}ms", ok ? "DONE" : "FAILED", jobId, (System.nanoTime() - t0) / 1_000_000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("JOB INTERRUPTED jobId={} while waiting for a pipeline slot", jobId);
            fail(jobId, new JobError(ErrorKind.SYSTEM, null, MSG_SYSTEM));
        } finally {
            if (acquired) {
                pipelineSemaphore.release();
            }
        }
    }

    boolean runJob(Job job) {
        UUID id = job.id();
        try {
            Path media = acquireMedia(job);

            checkCancelled(id);
            MediaSampler.MediaInfo info = probe(media);
            LOGGER.info("PROBE jobId={} duration={}s video={}x{} audio={}", id, info.durationSec(), info.width(), info.height(), info.hasAudio());

            List<AnalyzerResult> results = analysisService.analyze(new AnalysisRequest(id, media, info),
                    () -> jobStore.isCancelRequested(id),
                    (finished, total) -> progress(id, 30 + (30 * finished) / Math.max(1, total), null));

            checkCancelled(id);
            EngagementCurve curve = fusion.fuse(results, info.durationSec());
            SelectorConfig selectorConfig = analysisProperties.getSelection().toSelectorConfig(job.clipDurationSec(), job.clipCount());
            List<Segment> selected = selector.select(curve, selectorConfig);
            LOGGER.info("SELECT jobId={} curvePoints={} requested={} selected={}", id, curve.size(), job.clipCount(), selected.size());

            checkCancelled(id);
            jobStore.update(id, j -> j.advance(JobStage.PROCESSING, 60, MSG_PROCESSING, clock.instant()));
            if (selected.isEmpty()) {
                complete(id, List.of(), "Video is shorter than the requested clip duration, no clips generated");
                return true;
            }
            return renderAll(id, media, info, selected);
        } catch (JobCancelledException e) {
            handleCancelled(id);
            return false;
        } catch (DownloadException e) {
            LOGGER.warn("JOB DOWNLOAD FAILED jobId={} kind={} msg={}", id, e.getKind(), e.getMessage());
            return failUnlessCancelled(id, new JobError(ErrorKind.DOWNLOAD, e.getKind().name(), e.getMessage()));
        } catch (AnalysisException e) {
            LOGGER.warn("JOB ANALYSIS FAILED jobId={} subKind={} msg={}", id, e.getSubKind(), e.getMessage());
            return failUnlessCancelled(id, new JobError(ErrorKind.ANALYSIS, e.getSubKind(), e.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("JOB INTERRUPTED jobId={}", id);
            return failUnlessCancelled(id, new JobError(ErrorKind.SYSTEM, null, MSG_SYSTEM));
        } catch (Exception e) {
            LOGGER.error("Job {} failed: {}", id, e.toString(), e);
            return failUnlessCancelled(id, new JobError(ErrorKind.SYSTEM, null, MSG_SYSTEM));
        }
    }

    /**
     * Uses the cached download of the video when present, otherwise fetches it. Concurrent jobs for
     * the same video share one download; a job waiting for another job's download stays cancellable.
     */
    private Path acquireMedia(Job job) throws InterruptedException {
        UUID id = job.id();
        checkCancelled(id);
        DownloadLock lock = lockFor(job.videoId());
        try {
            while (!lock.mutex.tryLock(LOCK_POLL_MS, TimeUnit.MILLISECONDS)) {
                checkCancelled(id);
            }
        } catch (InterruptedException | JobCancelledException e) {
            releaseLock(job.videoId());
            throw e;
        }
        try {
            checkCancelled(id);
            Path target = storage.resolveDownload(job.videoId() + ".mp4");
            if (Files.exists(target)) {
                LOGGER.info("DOWNLOAD CACHED jobId={} file={}", id, target);
                jobStore.update(id, j -> j.advance(JobStage.ANALYZING, 25, MSG_CACHED, clock.instant()).withMediaPath(target, clock.instant()));
            } else {
                jobStore.update(id, j -> j.advance(JobStage.DOWNLOADING, 10, MSG_DOWNLOADING, clock.instant()));
                MediaFetcher.FetchedMedia fetched = fetcher.fetch(job.sourceUrl(), target,
                        pct -> progress(id, 10 + (int) (15 * Math.max(0.0, Math.min(100.0, pct)) / 100.0), null),
                        () -> isCancelled(id));
                LOGGER.info("DOWNLOAD DONE jobId={} title='{}' duration={}s", id, fetched.title(), fetched.durationSec());
                checkCancelled(id);
                jobStore.update(id, j -> j.advance(JobStage.ANALYZING, 25, MSG_ANALYZING, clock.instant())
                        .withMediaPath(fetched.file() != null ? fetched.file() : target, clock.instant()));
            }
        } finally {
            lock.mutex.unlock();
            releaseLock(job.videoId());
        }
        checkCancelled(id);
        jobStore.update(id, j -> j.withProgress(30, MSG_ANALYZING, clock.instant()));
        return jobStore.get(id).map(Job::mediaPath).orElseThrow(() -> new JobCancelledException(id));
    }

    private DownloadLock lockFor(String videoId) {
        return downloadLocks.compute(videoId, (key, current) -> {
            DownloadLock lock = current != null ? current : new DownloadLock();
            lock.users++;
            return lock;
        });
    }

    // the entry goes away with its last user
    private void releaseLock(String videoId) {
        downloadLocks.computeIfPresent(videoId, (key, lock) -> --lock.users == 0 ? null : lock);
    }

    int downloadLockCount() {
        return downloadLocks.size();
    }

    private MediaSampler.MediaInfo probe(Path media) {
        MediaSampler.MediaInfo info;
        try {
            info = sampler.probe(media);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisException(AnalysisException.MEDIA_UNREADABLE, "Interrupted while reading the video", e);
        } catch (Exception e) {
            throw new AnalysisException(AnalysisException.MEDIA_UNREADABLE, "Could not read the downloaded video", e);
        }
        if (info == null || info.durationSec() <= 0) {
            throw new AnalysisException(AnalysisException.MEDIA_UNREADABLE, "Downloaded video has no duration");
        }
        return info;
    }

    private boolean renderAll(UUID id, Path media, MediaSampler.MediaInfo info, List<Segment> selected) throws InterruptedException {
        int n = selected.size();
        List<Segment> out = new ArrayList<>(n);
        int ok = 0;
        for (int i = 0; i < n; i++) {
            checkCancelled(id);
            Segment segment = selected.get(i);
            progress(id, 60 + (40 * i) / n, "Processing clip " + (i + 1) + " of " + n + "...");
            Path target = storage.resolveOutput(id, "clip_" + segment.index() + ".mp4");
            try {
                RenderResult result = renderEngine.render(media, info, segment.startSec(), segment.endSec(), target, renderOptions);
                LOGGER.info("RENDER OK jobId={} clip={} start={} end={} size={}B in={}ms", id, segment.index(),
                        segment.startSec(), segment.endSec(), result.sizeBytes(), result.tookMs());
                out.add(segment.withOutput(result.output()));
                ok++;
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                if (jobStore.isCancelRequested(id)) {
                    throw new JobCancelledException(id);
                }
                LOGGER.warn("RENDER FAILED jobId={} clip={} err={}", id, segment.index(), e.toString());
                out.add(segment.withRenderError(firstLine(e.getMessage())));
            }
            // 100 is reserved for completion
            progress(id, Math.min(99, 60 + (40 * (i + 1)) / n), null);
        }

        if (ok == 0) {
            fail(id, new JobError(ErrorKind.RENDER, "ALL_FAILED", "All " + n + " clips failed to render"));
            return false;
        }
        checkCancelled(id);
        complete(id, out, "Successfully generated " + ok + " clips!");
        return true;
    }

    private void checkCancelled(UUID id) {
        if (isCancelled(id)) {
            throw new JobCancelledException(id);
        }
    }

    private boolean isCancelled(UUID id) {
        return jobStore.isCancelRequested(id) || jobStore.get(id).isEmpty();
    }

    private void progress(UUID id, int value, String message) {
        jobStore.update(id, j -> j.isTerminal() ? j : j.withProgress(value, message, clock.instant()));
    }

    /**
     * Checks the cancel flag in the same atomic update that completes the job, so a cancel accepted
     * by {@link JobStore#requestCancel} never ends in {@code COMPLETED}.
     */
    private void complete(UUID id, List<Segment> segments, String message) {
        jobStore.update(id, j -> {
            if (jobStore.isCancelRequested(id)) {
                throw new JobCancelledException(id);
            }
            return j.complete(segments, message, clock.instant());
        });
    }

    private void fail(UUID id, JobError error) {
        jobStore.update(id, j -> j.isTerminal() ? j : j.fail(error, clock.instant()));
    }

    private boolean failUnlessCancelled(UUID id, JobError error) {
        if (jobStore.isCancelRequested(id)) {
            handleCancelled(id);
        } else {
            fail(id, error);
        }
        return false;
    }

    private void handleCancelled(UUID id) {
        fail(id, new JobError(ErrorKind.CANCELLED, null, "Job cancelled"));
        try {
            storage.deleteOutputs(id);
        } catch (StorageException e) {
            LOGGER.warn("JOB CANCEL cleanup failed jobId={} err={}", id, e.toString());
        }
        jobStore.remove(id);
        LOGGER.info("JOB CANCELLED jobId={}", id);
    }

    private static final class DownloadLock {
        private final ReentrantLock mutex = new ReentrantLock();
        // guarded by the map's compute
        private int users;
    }

    private static String firstLine(String message) {
        if (message == null || message.isBlank()) {
            return "Render failed";
        }
        int nl = message.indexOf('\n');
        return nl < 0 ? message : message.substring(0, nl);
    }
}
