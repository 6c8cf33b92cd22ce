package com.example.shorts_backend.config;

import com.example.shorts_backend.dto.RenderOptions;
import com.example.shorts_backend.engine.CommandFaceDetector;
import com.example.shorts_backend.engine.FfmpegClipRenderEngine;
import com.example.shorts_backend.engine.Interfaces.ClipRenderEngine;
import com.example.shorts_backend.engine.Interfaces.FaceDetector;
import com.example.shorts_backend.engine.Interfaces.MediaSampler;
import com.example.shorts_backend.engine.OpenCvFaceDetector;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class EngineConfig {

    @Bean
    public ClipRenderEngine clipRenderEngine(
            @Value("${ffmpeg.binary:ffmpeg}") String ffmpegBin,
            @Value("${clip.render.timeoutSeconds:300}") long timeoutSeconds
    ) {
        return new FfmpegClipRenderEngine(ffmpegBin, Duration.ofSeconds(Math.max(1, timeoutSeconds)));
    }

    @Bean
    public RenderOptions renderOptions(@Value("${clip.render.profile:default}") String profile) {
        return "low".equalsIgnoreCase(profile) ? RenderOptions.LOW : RenderOptions.DEFAULT;
    }

    @Bean
    @ConditionalOnProperty(name = "analysis.faces.engine", havingValue = "opencv", matchIfMissing = true)
    public FaceDetector openCvFaceDetector(AnalysisProperties props, MediaSampler sampler) {
        AnalysisProperties.Faces faces = props.getFaces();
        return new OpenCvFaceDetector(sampler, faces.getWidth(), faces.getHeight(), faces.getCascadeFile());
    }

    @Bean
    @ConditionalOnProperty(name = "analysis.faces.engine", havingValue = "command")
    public FaceDetector commandFaceDetector(AnalysisProperties props, ObjectMapper objectMapper) {
        return new CommandFaceDetector(props.getFaces().getCommand(),
                Duration.ofSeconds(Math.max(1, props.getFaces().getTimeoutSeconds())), objectMapper);
    }
}
