package com.example.shorts_backend.engine;

import com.example.shorts_backend.dto.analysis.AnalysisRequest;
import com.example.shorts_backend.dto.analysis.AnalyzerResult;
import com.example.shorts_backend.dto.analysis.AnalyzerScore;
import com.example.shorts_backend.dto.analysis.FrameInsight;
import com.example.shorts_backend.dto.analysis.TimedScore;
import com.example.shorts_backend.engine.Interfaces.MediaSampler;
import com.example.shorts_backend.engine.Interfaces.SignalAnalyzer;
import com.example.shorts_backend.service.OllamaVisionClient;
import com.example.shorts_backend.util.AnalyzerKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rates sampled frames with a vision model. At most {@code maxFrames} frames are sent; on long
 * media the interval widens so the samples still cover the whole duration.
 */
public class SemanticContentAnalyzer implements SignalAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(SemanticContentAnalyzer.class);
    private static final int FRAME_MAX_WIDTH = 640;

    private final MediaSampler sampler;
    private final OllamaVisionClient client;
    private final double intervalSec;
    private final int maxFrames;

    public SemanticContentAnalyzer(MediaSampler sampler, OllamaVisionClient client, double intervalSec, int maxFrames) {
        this.sampler = sampler;
        this.client = client;
        this.intervalSec = intervalSec > 0 ? intervalSec : 3.0;
        this.maxFrames = Math.max(1, maxFrames);
    }

    @Override
    public AnalyzerKind kind() {
        return AnalyzerKind.SEMANTIC;
    }

    @Override
    public double sampleIntervalSec() {
        return intervalSec;
    }

    @Override
    public boolean isAvailable() {
        return client.isAvailable();
    }

    @Override
    public AnalyzerResult analyze(AnalysisRequest request) throws Exception {
        if (!request.info().hasVideo()) {
            return AnalyzerResult.unavailable(kind(), "no video stream");
        }
        List<Double> timestamps = sampleTimes(request.durationSec());
        List<TimedScore> scores = new ArrayList<>(timestamps.size());
        long t0 = System.nanoTime();
        for (double t : timestamps) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Semantic analysis interrupted at t=" + t);
            }
            byte[] jpeg = sampler.extractJpeg(request.mediaFile(), t, FRAME_MAX_WIDTH);
            FrameInsight insight = client.describeFrame(jpeg);
            scores.add(new TimedScore(t, new AnalyzerScore(insight.engagementScore(), metadata(insight))));
        }
        LOGGER.info("SEMANTIC jobId={} model={} frames={} in={}ms", request.jobId(), client.model(), scores.size(), (System.nanoTime() - t0) / 1_000_000);
        return AnalyzerResult.of(kind(), scores);
    }

    List<Double> sampleTimes(double durationSec) {
        List<Double> times = new ArrayList<>();
        if (durationSec <= 0) {
            return times;
        }
        double step = Math.max(intervalSec, durationSec / maxFrames);
        for (int k = 0; k < maxFrames; k++) {
            double t = k * step;
            if (t >= durationSec) {
                break;
            }
            times.add(t);
        }
        return times;
    }

    private static Map<String, Object> metadata(FrameInsight insight) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("description", insight.description());
        meta.put("contentType", insight.contentType());
        meta.put("viralPotential", insight.viralPotential());
        meta.put("mood", insight.mood());
        meta.put("hasPerson", insight.hasPerson());
        meta.put("hasText", insight.hasText());
        meta.put("baseScore", insight.baseScore());
        return meta;
    }
}
