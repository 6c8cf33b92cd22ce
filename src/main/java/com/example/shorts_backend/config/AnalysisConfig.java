package com.example.shorts_backend.config;

import com.example.shorts_backend.engine.AudioEnergyAnalyzer;
import com.example.shorts_backend.engine.FacePresenceAnalyzer;
import com.example.shorts_backend.engine.FfmpegMediaSampler;
import com.example.shorts_backend.engine.Interfaces.FaceDetector;
import com.example.shorts_backend.engine.Interfaces.MediaSampler;
import com.example.shorts_backend.engine.Interfaces.SignalAnalyzer;
import com.example.shorts_backend.engine.MotionAnalyzer;
import com.example.shorts_backend.engine.SceneChangeAnalyzer;
import com.example.shorts_backend.engine.SemanticContentAnalyzer;
import com.example.shorts_backend.fusion.ScoreFusion;
import com.example.shorts_backend.fusion.WeightTable;
import com.example.shorts_backend.service.OllamaVisionClient;
import com.example.shorts_backend.util.AnalyzerKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Configuration
@EnableConfigurationProperties(AnalysisProperties.class)
public class AnalysisConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisConfig.class);

    @Bean
    public MediaSampler mediaSampler(@Value("${ffmpeg.binary:ffmpeg}") String ffmpegBin,
                                     @Value("${ffprobe.binary:ffprobe}") String ffprobeBin,
                                     @Value("${analysis.sampler.timeoutSeconds:1800}") long timeoutSeconds,
                                     ObjectMapper objectMapper) {
        return new FfmpegMediaSampler(ffmpegBin, ffprobeBin, Duration.ofSeconds(Math.max(1, timeoutSeconds)), objectMapper);
    }

    @Bean
    public List<SignalAnalyzer> signalAnalyzers(AnalysisProperties props,
                                                MediaSampler sampler,
                                                FaceDetector faceDetector,
                                                OllamaVisionClient ollama) {
        List<SignalAnalyzer> analyzers = new ArrayList<>();
        if (props.getSemantic().isEnabled()) {
            analyzers.add(new SemanticContentAnalyzer(sampler, ollama,
                    props.getSemantic().getIntervalSec(), props.getSemantic().getMaxFrames()));
        }
        if (props.getAudio().isEnabled()) {
            analyzers.add(new AudioEnergyAnalyzer(sampler, props.getAudio().getSampleRate(), props.getAudio().getWindowSec()));
        }
        if (props.getMotion().isEnabled()) {
            analyzers.add(new MotionAnalyzer(sampler, frameSpec(props.getMotion())));
        }
        if (props.getScene().isEnabled()) {
            analyzers.add(new SceneChangeAnalyzer(sampler, frameSpec(props.getScene())));
        }
        if (props.getFaces().isEnabled()) {
            analyzers.add(new FacePresenceAnalyzer(faceDetector, props.getFaces().getIntervalSec()));
        }
        LOGGER.info("Analyzers wired: {}", analyzers.stream().map(a -> a.kind().key()).toList());
        return List.copyOf(analyzers);
    }

    @Bean
    public WeightTable weightTable(AnalysisProperties props) {
        return new WeightTable(toKinds(props.getWeights()), toKinds(props.getFallbackWeights()));
    }

    @Bean
    public ScoreFusion scoreFusion(WeightTable weightTable, AnalysisProperties props) {
        return new ScoreFusion(weightTable, props.getAlignmentToleranceSec());
    }

    private static MediaSampler.FrameSpec frameSpec(AnalysisProperties.Frames frames) {
        return new MediaSampler.FrameSpec(frames.getIntervalSec(), frames.getWidth(), frames.getHeight());
    }

    private static Map<AnalyzerKind, Double> toKinds(Map<String, Double> byKey) {
        Map<AnalyzerKind, Double> out = new EnumMap<>(AnalyzerKind.class);
        byKey.forEach((key, weight) -> out.put(AnalyzerKind.fromKey(key), weight));
        return out;
    }
}
