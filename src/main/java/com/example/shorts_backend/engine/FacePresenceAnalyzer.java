package com.example.shorts_backend.engine;

import com.example.shorts_backend.dto.analysis.AnalysisRequest;
import com.example.shorts_backend.dto.analysis.AnalyzerResult;
import com.example.shorts_backend.dto.analysis.AnalyzerScore;
import com.example.shorts_backend.dto.analysis.TimedScore;
import com.example.shorts_backend.engine.Interfaces.FaceDetector;
import com.example.shorts_backend.engine.Interfaces.SignalAnalyzer;
import com.example.shorts_backend.util.AnalyzerKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Scores how prominently people appear on screen: {@code min(100, 500 * faceAreaRatio + 10 * faceCount)}.
 */
public class FacePresenceAnalyzer implements SignalAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(FacePresenceAnalyzer.class);

    private final FaceDetector detector;
    private final double intervalSec;

    public FacePresenceAnalyzer(FaceDetector detector, double intervalSec) {
        this.detector = detector;
        this.intervalSec = intervalSec > 0 ? intervalSec : 1.0;
    }

    @Override
    public AnalyzerKind kind() {
        return AnalyzerKind.FACES;
    }

    @Override
    public double sampleIntervalSec() {
        return intervalSec;
    }

    @Override
    public boolean isAvailable() {
        return detector.isAvailable();
    }

    @Override
    public AnalyzerResult analyze(AnalysisRequest request) throws Exception {
        if (!request.info().hasVideo()) {
            return AnalyzerResult.unavailable(kind(), "no video stream");
        }
        List<FaceDetector.FrameFaces> frames = detector.detect(request.mediaFile(), intervalSec);
        List<TimedScore> scores = new ArrayList<>(frames.size());
        for (FaceDetector.FrameFaces frame : frames) {
            scores.add(new TimedScore(frame.timeSec(), score(frame)));
        }
        LOGGER.debug("FACES jobId={} samples={}", request.jobId(), scores.size());
        return AnalyzerResult.of(kind(), scores);
    }

    static AnalyzerScore score(FaceDetector.FrameFaces frame) {
        int count = frame.faces().size();
        long frameArea = (long) frame.frameWidth() * frame.frameHeight();
        long faceArea = frame.faces().stream().mapToLong(FaceDetector.FaceBox::area).sum();
        double ratio = frameArea <= 0 ? 0.0 : Math.min(1.0, (double) faceArea / frameArea);
        double value = Math.min(100.0, ratio * 500.0 + count * 10.0);
        return new AnalyzerScore(value, Map.of("faceCount", count, "faceAreaRatio", ratio));
    }
}
