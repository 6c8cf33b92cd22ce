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
 * Scores cuts and visual changes as the mean absolute pixel difference between consecutive sampled
 * frames, as a percentage of the full luma range.
 */
public class SceneChangeAnalyzer implements SignalAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(SceneChangeAnalyzer.class);

    private final MediaSampler sampler;
    private final MediaSampler.FrameSpec frameSpec;

    public SceneChangeAnalyzer(MediaSampler sampler, MediaSampler.FrameSpec frameSpec) {
        this.sampler = sampler;
        this.frameSpec = frameSpec;
    }

    @Override
    public AnalyzerKind kind() {
        return AnalyzerKind.SCENE;
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
                double diff = OpticalFlow.meanAbsoluteDifference(previous[0], frame);
                scores.add(new TimedScore(frame.timeSec(),
                        new AnalyzerScore(diff / 255.0 * 100.0, Map.of("meanDiff", diff))));
            }
            previous[0] = frame;
        });
        LOGGER.debug("SCENE jobId={} samples={}", request.jobId(), scores.size());
        return AnalyzerResult.of(kind(), scores);
    }
}
