package com.example.shorts_backend.dto.analysis;

import java.util.Map;

/**
 * Normalized analyzer output for one sample.
 *
 * @param value    score clamped to [0,100].
 * @param metadata analyzer specific details such as face count or content type.
 */
public record AnalyzerScore(double value, Map<String, Object> metadata) {

    public AnalyzerScore {
        value = clamp(value);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static AnalyzerScore of(double value) {
        return new AnalyzerScore(value, Map.of());
    }

    public static double clamp(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(100.0, value);
    }
}
