package com.example.shorts_backend.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.shorts_backend.config.AnalysisProperties;
import com.example.shorts_backend.config.WorkerExecutorProperties;
import com.example.shorts_backend.dto.RenderOptions;
import com.example.shorts_backend.engine.Interfaces.ClipRenderEngine;
import com.example.shorts_backend.engine.Interfaces.MediaFetcher;
import com.example.shorts_backend.engine.Interfaces.MediaSampler;
import com.example.shorts_backend.exception.DownloadException;
import com.example.shorts_backend.fusion.ScoreFusion;
import com.example.shorts_backend.fusion.WeightTable;
import com.example.shorts_backend.model.Job;
import com.example.shorts_backend.selector.GreedySegmentSelector;
import com.example.shorts_backend.util.ErrorKind;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class WorkerServiceConcurrencyTest {

    @TempDir Path tempDir;

    @Mock private MediaFetcher fetcher;
    @Mock private MediaSampler sampler;
    @Mock private AnalysisService analysisService;
    @Mock private ClipRenderEngine renderEngine;

    private ExecutorService executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void pipelinesRespectConcurrencyLimit() throws Exception {
        WorkerExecutorProperties props = new WorkerExecutorProperties();
        props.setMaxActivePipelines(2);
        props.setExecutorThreads(3);

        executor = Executors.newFixedThreadPool(props.getExecutorThreads());
        JobStore jobStore = new JobStore();
        WorkerService workerService = workerService(jobStore, props);

        CountDownLatch firstTwo = new CountDownLatch(2);
        CountDownLatch allowFinish = new CountDownLatch(1);
        AtomicInteger concurrent = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();

        when(fetcher.fetch(any(), any(), any(), any())).thenAnswer(inv -> {
            int current = concurrent.incrementAndGet();
            maxConcurrent.updateAndGet(v -> Math.max(v, current));
            firstTwo.countDown();
            allowFinish.await(2, TimeUnit.SECONDS);
            concurrent.decrementAndGet();
            throw new DownloadException(DownloadException.Kind.UNAVAILABLE, "Video is unavailable");
        });

        List<UUID> ids = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            UUID id = UUID.randomUUID();
            String videoId = "video000000" + i;
            jobStore.insert(Job.queued(id, "https://youtu.be/" + videoId, videoId, 60, 5, Instant.now()));
            ids.add(id);
            workerService.submit(id);
        }

        assertTrue(firstTwo.await(2, TimeUnit.SECONDS));
        allowFinish.countDown();
        long deadline = System.currentTimeMillis() + 5_000;
        while (System.currentTimeMillis() < deadline
                && !ids.stream().allMatch(id -> jobStore.get(id).map(Job::isTerminal).orElse(false))) {
            Thread.sleep(20);
        }

        assertTrue(ids.stream().allMatch(id -> jobStore.get(id).orElseThrow().isTerminal()));
        assertEquals(2, maxConcurrent.get());
        verify(fetcher, times(3)).fetch(any(), any(), any(), any());
    }

    @Test
    void jobWaitingOnSharedDownloadCanBeCancelled() throws Exception {
        WorkerExecutorProperties props = new WorkerExecutorProperties();
        props.setMaxActivePipelines(2);
        props.setExecutorThreads(2);

        executor = Executors.newFixedThreadPool(props.getExecutorThreads());
        JobStore jobStore = new JobStore();
        WorkerService workerService = workerService(jobStore, props);

        CountDownLatch downloading = new CountDownLatch(1);
        CountDownLatch allowFinish = new CountDownLatch(1);
        when(fetcher.fetch(any(), any(), any(), any())).thenAnswer(inv -> {
            downloading.countDown();
            allowFinish.await(5, TimeUnit.SECONDS);
            throw new DownloadException(DownloadException.Kind.UNAVAILABLE, "Video is unavailable");
        });

        Job first = Job.queued(UUID.randomUUID(), "https://youtu.be/sharedVideo", "sharedVideo", 60, 5, Instant.now());
        Job second = Job.queued(UUID.randomUUID(), "https://youtu.be/sharedVideo", "sharedVideo", 60, 5, Instant.now());
        jobStore.insert(first);
        jobStore.insert(second);
        Future<Boolean> firstRun = executor.submit(() -> workerService.runJob(first));
        assertTrue(downloading.await(2, TimeUnit.SECONDS));
        Future<Boolean> secondRun = executor.submit(() -> workerService.runJob(second));
        Thread.sleep(300);

        jobStore.requestCancel(second.id());

        assertFalse(secondRun.get(2, TimeUnit.SECONDS));
        assertTrue(jobStore.get(second.id()).isEmpty());
        assertFalse(firstRun.isDone());

        allowFinish.countDown();
        assertFalse(firstRun.get(5, TimeUnit.SECONDS));
        assertEquals(ErrorKind.DOWNLOAD, jobStore.get(first.id()).orElseThrow().error().kind());
        assertEquals(0, workerService.downloadLockCount());
        verify(fetcher, times(1)).fetch(any(), any(), any(), any());
    }

    private WorkerService workerService(JobStore jobStore, WorkerExecutorProperties props) {
        return new WorkerService(
                jobStore,
                new LocalStorageService(tempDir, "downloads", "outputs"),
                fetcher,
                sampler,
                analysisService,
                new ScoreFusion(WeightTable.defaults(), 1.0),
                new GreedySegmentSelector(),
                renderEngine,
                RenderOptions.DEFAULT,
                new AnalysisProperties(),
                executor,
                props,
                Clock.systemUTC());
    }
}
