package com.example.shorts_backend.service;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.example.shorts_backend.config.WorkerExecutorProperties;
import com.example.shorts_backend.dto.analysis.AnalysisRequest;
import com.example.shorts_backend.dto.analysis.AnalyzerResult;
import com.example.shorts_backend.dto.analysis.AnalyzerScore;
import com.example.shorts_backend.dto.analysis.TimedScore;
import com.example.shorts_backend.engine.Interfaces.MediaSampler;
import com.example.shorts_backend.engine.Interfaces.SignalAnalyzer;
import com.example.shorts_backend.exception.JobCancelledException;
import com.example.shorts_backend.util.AnalyzerKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AnalysisServiceTest {

    private static final AnalysisRequest REQUEST = new AnalysisRequest(UUID.randomUUID(), Path.of("video.mp4"),
            new MediaSampler.MediaInfo(120, 1920, 1080, 30, true));

    private ExecutorService executor;
    private ListAppender<ILoggingEvent> appender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(5);
        logger = (Logger) LoggerFactory.getLogger(AnalysisService.class);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
        executor.shutdownNow();
    }

    @Test
    void collectsOneResultPerAnalyzerInKindOrder() throws Exception {
        AnalysisService service = service(executor, 60,
                analyzer(AnalyzerKind.MOTION, () -> ok(AnalyzerKind.MOTION, 40)),
                analyzer(AnalyzerKind.AUDIO, () -> ok(AnalyzerKind.AUDIO, 70)));

        List<AnalyzerResult> results = service.analyze(REQUEST, () -> false, null);

        assertThat(results).extracting(AnalyzerResult::kind).containsExactly(AnalyzerKind.AUDIO, AnalyzerKind.MOTION);
        assertThat(results).allMatch(AnalyzerResult::usable);
        assertThat(service.analyzerCount()).isEqualTo(2);
    }

    @Test
    void failingAnalyzerIsUnavailableAndOthersSurvive() throws Exception {
        AnalysisService service = service(executor, 60,
                analyzer(AnalyzerKind.FACES, () -> {
                    throw new IllegalStateException("detector crashed");
                }),
                analyzer(AnalyzerKind.SCENE, () -> ok(AnalyzerKind.SCENE, 30)));

        List<AnalyzerResult> results = service.analyze(REQUEST, () -> false, null);

        assertThat(results).hasSize(2);
        AnalyzerResult faces = results.stream().filter(r -> r.kind() == AnalyzerKind.FACES).findFirst().orElseThrow();
        assertThat(faces.status()).isEqualTo(AnalyzerResult.Status.UNAVAILABLE);
        assertThat(faces.detail()).contains("detector crashed");
        assertThat(results.stream().filter(r -> r.kind() == AnalyzerKind.SCENE).findFirst().orElseThrow().usable()).isTrue();
        assertThat(appender.list).anySatisfy(event -> {
            assertThat(event.getLevel()).isEqualTo(Level.WARN);
            assertThat(event.getFormattedMessage()).contains("ANALYZER FAILED").contains("kind=faces");
        });
    }

    @Test
    void analyzerReportingUnavailableIsNotInvoked() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        SignalAnalyzer offline = new StubAnalyzer(AnalyzerKind.SEMANTIC, () -> {
            calls.incrementAndGet();
            return ok(AnalyzerKind.SEMANTIC, 90);
        }, false);
        AnalysisService service = service(executor, 60, offline);

        List<AnalyzerResult> results = service.analyze(REQUEST, () -> false, null);

        assertThat(results).singleElement().satisfies(r -> {
            assertThat(r.status()).isEqualTo(AnalyzerResult.Status.UNAVAILABLE);
            assertThat(r.detail()).isEqualTo("analyzer not available");
        });
        assertThat(calls).hasValue(0);
    }

    @Test
    void slowAnalyzerTimesOutAndIsInterrupted() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        AnalysisService service = service(executor, 1,
                analyzer(AnalyzerKind.MOTION, () -> {
                    try {
                        Thread.sleep(30_000);
                    } catch (InterruptedException e) {
                        interrupted.countDown();
                        throw e;
                    }
                    return ok(AnalyzerKind.MOTION, 10);
                }),
                analyzer(AnalyzerKind.AUDIO, () -> ok(AnalyzerKind.AUDIO, 50)));

        List<AnalyzerResult> results = service.analyze(REQUEST, () -> false, null);

        assertThat(results).extracting(AnalyzerResult::kind).containsExactly(AnalyzerKind.AUDIO, AnalyzerKind.MOTION);
        assertThat(results.get(0).usable()).isTrue();
        assertThat(results.get(1).status()).isEqualTo(AnalyzerResult.Status.UNAVAILABLE);
        assertThat(results.get(1).detail()).isEqualTo("timed out after 1s");
        assertTrue(interrupted.await(5, TimeUnit.SECONDS));
    }

    @Test
    void cancellationInterruptsRunningAnalyzers() {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        AnalysisService service = service(executor, 60,
                analyzer(AnalyzerKind.FACES, () -> {
                    started.countDown();
                    try {
                        Thread.sleep(30_000);
                    } catch (InterruptedException e) {
                        interrupted.countDown();
                        throw e;
                    }
                    return ok(AnalyzerKind.FACES, 10);
                }));

        assertThatThrownBy(() -> service.analyze(REQUEST, () -> started.getCount() == 0, null))
                .isInstanceOf(JobCancelledException.class);
        assertThat(awaitQuietly(interrupted)).isTrue();
    }

    @Test
    void rejectedAnalyzersAreUnavailable() throws Exception {
        Executor rejecting = command -> {
            throw new RejectedExecutionException("pool full");
        };
        AnalysisService service = service(rejecting, 60,
                analyzer(AnalyzerKind.AUDIO, () -> ok(AnalyzerKind.AUDIO, 50)));

        List<AnalyzerResult> results = service.analyze(REQUEST, () -> false, null);

        assertThat(results).singleElement().satisfies(r -> {
            assertThat(r.status()).isEqualTo(AnalyzerResult.Status.UNAVAILABLE);
            assertThat(r.detail()).isEqualTo("rejected by analyzer pool");
        });
    }

    @Test
    void reportsProgressAfterEachAnalyzer() throws Exception {
        AnalysisService service = service(executor, 60,
                analyzer(AnalyzerKind.AUDIO, () -> ok(AnalyzerKind.AUDIO, 50)),
                analyzer(AnalyzerKind.MOTION, () -> ok(AnalyzerKind.MOTION, 50)),
                analyzer(AnalyzerKind.SCENE, () -> ok(AnalyzerKind.SCENE, 50)));
        List<String> calls = new ArrayList<>();

        service.analyze(REQUEST, () -> false, (finished, total) -> calls.add(finished + "/" + total));

        assertThat(calls).containsExactly("1/3", "2/3", "3/3");
    }

    private static boolean awaitQuietly(CountDownLatch latch) {
        try {
            return latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static AnalysisService service(Executor executor, long timeoutSeconds, SignalAnalyzer... analyzers) {
        WorkerExecutorProperties props = new WorkerExecutorProperties();
        props.setAnalyzerTimeoutSeconds(timeoutSeconds);
        return new AnalysisService(List.of(analyzers), executor, props);
    }

    private static SignalAnalyzer analyzer(AnalyzerKind kind, Body body) {
        return new StubAnalyzer(kind, body, true);
    }

    private static AnalyzerResult ok(AnalyzerKind kind, double value) {
        return AnalyzerResult.of(kind, List.of(new TimedScore(0, AnalyzerScore.of(value)), new TimedScore(1, AnalyzerScore.of(value))));
    }

    @FunctionalInterface
    private interface Body {
        AnalyzerResult run() throws Exception;
    }

    private record StubAnalyzer(AnalyzerKind kind, Body body, boolean available) implements SignalAnalyzer {

        @Override
        public double sampleIntervalSec() {
            return 1.0;
        }

        @Override
        public boolean isAvailable() {
            return available;
        }

        @Override
        public AnalyzerResult analyze(AnalysisRequest request) throws Exception {
            return body.run();
        }
    }
}
