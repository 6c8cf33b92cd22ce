package com.example.shorts_backend.engine;

import com.example.shorts_backend.dto.analysis.AnalysisRequest;
import com.example.shorts_backend.dto.analysis.AnalyzerResult;
import com.example.shorts_backend.dto.analysis.AnalyzerScore;
import com.example.shorts_backend.dto.analysis.TimedScore;
import com.example.shorts_backend.engine.Interfaces.MediaSampler;
import com.example.shorts_backend.engine.Interfaces.SignalAnalyzer;
import com.example.shorts_backend.util.AnalyzerKind;
import com.example.shorts_backend.util.OpticalFlow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Scores visual motion as ten times the mean optical flow magnitude between consecutive sampled
 * frames, capped at 100.
 */
public class MotionAnalyzer implements SignalAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(MotionAnalyzer.class);
    static final double MAGNITUDE_SCALE = 10.0;
    private static final int FLOW_RADIUS = 2;

    private final MediaSampler sampler;
    private final MediaSampler.FrameSpec frameSpec;

    public MotionAnalyzer(MediaSampler sampler, MediaSampler.FrameSpec frameSpec) {
        this.sampler = sampler;
        this.frameSpec = frameSpec;
    }

    @Override
    public AnalyzerKind kind() {
        return AnalyzerKind.MOTION;
    }

    @Override
    public double sampleIntervalSec() {
        return frameSpec.intervalSec();
    }

    @Override
    public AnalyzerResult analyze(AnalysisRequest request) throws Exception {
        if (!request.info().hasVideo()) {
            return AnalyzerResult.unavailable(kind(), "no video stream");
        }
        List<TimedScore> scores = new ArrayList<>();
        MediaSampler.GrayFrame[] previous = new MediaSampler.GrayFrame[1];
        sampler.streamGrayFrames(request.mediaFile(), frameSpec, frame -> {
            if (previous[0] != null) {
                double magnitude = OpticalFlow.meanMagnitude(previous[0], frame, FLOW_RADIUS);
                scores.add(new TimedScore(frame.timeSec(),
                        new AnalyzerScore(magnitude * MAGNITUDE_SCALE, Map.of("magnitude", magnitude))));
            }
            previous[0] = frame;
        });
        LOGGER.debug("MOTION jobId={} samples={}", request.jobId(), scores.size());
        return AnalyzerResult.of(kind(), scores);
    }
}
