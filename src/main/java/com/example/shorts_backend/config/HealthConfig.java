package com.example.shorts_backend.config;

import com.example.shorts_backend.service.OllamaVisionClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator ffmpegHealth(@Value("${ffmpeg.binary:ffmpeg}") String ffmpegBin) {
        return () -> {
            try {
                var p = new ProcessBuilder(ffmpegBin, "-version").redirectErrorStream(true).start();
                p.getInputStream().transferTo(java.io.OutputStream.nullOutputStream());
                if (p.waitFor(5, TimeUnit.SECONDS) && p.exitValue() == 0) {
                    return Health.up().withDetail("ffmpeg", "ok").build();
                }
                p.destroyForcibly();
                return Health.down().withDetail("ffmpeg", "not responding").build();
            } catch (IOException e) {
                return Health.down(e).withDetail("ffmpeg", "missing").build();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Health.unknown().withDetail("ffmpeg", "interrupted").build();
            }
        };
    }

    @Bean
    public HealthIndicator ollamaHealth(OllamaVisionClient ollama) {
        // semantic analysis is optional: an absent model is UNKNOWN, not DOWN
        return () -> {
            try {
                return ollama.hasModel()
                        ? Health.up().withDetail("ollama", ollama.model()).build()
                        : Health.unknown().withDetail("ollama", "model missing: " + ollama.model()).build();
            } catch (Exception e) {
                return Health.unknown().withDetail("ollama", "unreachable").withException(e).build();
            }
        };
    }
}
