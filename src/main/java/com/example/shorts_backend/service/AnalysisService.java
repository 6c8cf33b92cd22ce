package com.example.shorts_backend.service;

import com.example.shorts_backend.config.WorkerExecutorProperties;
import com.example.shorts_backend.dto.analysis.AnalysisRequest;
import com.example.shorts_backend.dto.analysis.AnalyzerResult;
import com.example.shorts_backend.engine.Interfaces.SignalAnalyzer;
import com.example.shorts_backend.exception.JobCancelledException;
import com.example.shorts_backend.util.AnalyzerKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Runs every configured analyzer of a job concurrently and collects one result per analyzer.
 * Analyzers that are unavailable, throw, are rejected by the pool or outlive the shared deadline
 * are reported {@link AnalyzerResult.Status#UNAVAILABLE}; the others are unaffected.
 */
@Service
public class AnalysisService {
    private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisService.class);
    private static final long POLL_SLICE_MS = 250;

    private final List<SignalAnalyzer> analyzers;
    private final Executor analyzerExecutor;
    private final Duration timeout;

    public AnalysisService(@Qualifier("signalAnalyzers") List<SignalAnalyzer> analyzers,
                           @Qualifier("analyzerTaskExecutor") Executor analyzerExecutor,
                           WorkerExecutorProperties properties) {
        this.analyzers = List.copyOf(analyzers);
        this.analyzerExecutor = analyzerExecutor;
        this.timeout = Duration.ofSeconds(Math.max(1, properties.getAnalyzerTimeoutSeconds()));
    }

    public int analyzerCount() {
        return analyzers.size();
    }

    /**
     * @param cancelled polled while waiting; once true, running analyzers are interrupted.
     * @param progress  called after each analyzer finished, from the calling thread.
     * @return one result per analyzer in analyzer order.
     * @throws JobCancelledException when {@code cancelled} turns true before all analyzers finished.
     */
    public List<AnalyzerResult> analyze(AnalysisRequest request, BooleanSupplier cancelled, ProgressCallback progress)
            throws InterruptedException {
        CompletionService<AnalyzerResult> completion = new ExecutorCompletionService<>(analyzerExecutor);
        Map<AnalyzerKind, AnalyzerResult> results = new EnumMap<>(AnalyzerKind.class);
        Map<Future<AnalyzerResult>, SignalAnalyzer> pending = new HashMap<>();
        int total = analyzers.size();
        int done = 0;

        for (SignalAnalyzer analyzer : analyzers) {
            try {
                pending.put(completion.submit(() -> runOne(analyzer, request)), analyzer);
            } catch (RejectedExecutionException e) {
                LOGGER.warn("ANALYZER REJECTED jobId={} kind={} err={}", request.jobId(), analyzer.kind().key(), e.toString());
                results.put(analyzer.kind(), AnalyzerResult.unavailable(analyzer.kind(), "rejected by analyzer pool"));
                done++;
            }
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            while (!pending.isEmpty()) {
                if (cancelled.getAsBoolean()) {
                    throw new JobCancelledException(request.jobId());
                }
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    for (SignalAnalyzer late : pending.values()) {
                        LOGGER.warn("ANALYZER TIMEOUT jobId={} kind={} after={}s", request.jobId(), late.kind().key(), timeout.toSeconds());
                        results.put(late.kind(), AnalyzerResult.unavailable(late.kind(), "timed out after " + timeout.toSeconds() + "s"));
                    }
                    break;
                }
                Future<AnalyzerResult> finished = completion.poll(Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(POLL_SLICE_MS)), TimeUnit.NANOSECONDS);
                if (finished == null) {
                    continue;
                }
                SignalAnalyzer analyzer = pending.remove(finished);
                results.put(analyzer.kind(), collect(request, analyzer, finished));
                done++;
                if (progress != null) {
                    progress.onProgress(done, total);
                }
            }
        } finally {
            pending.keySet().forEach(f -> f.cancel(true));
        }

        List<AnalyzerResult> ordered = new ArrayList<>(results.values());
        LOGGER.info("ANALYSIS DONE jobId={} usable={} of={}", request.jobId(),
                ordered.stream().filter(AnalyzerResult::usable).map(r -> r.kind().key()).toList(), total);
        return ordered;
    }

    private AnalyzerResult runOne(SignalAnalyzer analyzer, AnalysisRequest request) throws Exception {
        long t0 = System.nanoTime();
        if (!analyzer.isAvailable()) {
            LOGGER.info("ANALYZER SKIP jobId={} kind={} reason=unavailable", request.jobId(), analyzer.kind().key());
            return AnalyzerResult.unavailable(analyzer.kind(), "analyzer not available");
        }
        AnalyzerResult result = analyzer.analyze(request);
        if (result == null) {
            return AnalyzerResult.unavailable(analyzer.kind(), "analyzer returned no result");
        }
        LOGGER.info("ANALYZER DONE jobId={} kind={} status={} samples={} in={}ms", request.jobId(), analyzer.kind().key(),
                result.status(), result.samples().size(), (System.nanoTime() - t0) / 1_000_000);
        return result;
    }

    private AnalyzerResult collect(AnalysisRequest request, SignalAnalyzer analyzer, Future<AnalyzerResult> future)
            throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOGGER.warn("ANALYZER FAILED jobId={} kind={} err={}", request.jobId(), analyzer.kind().key(), cause.toString());
            return AnalyzerResult.unavailable(analyzer.kind(), "failed: " + cause.getMessage());
        }
    }

    @FunctionalInterface
    public interface ProgressCallback {
        void onProgress(int finished, int total);
    }
}
