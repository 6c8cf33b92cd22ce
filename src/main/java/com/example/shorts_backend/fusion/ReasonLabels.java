package com.example.shorts_backend.fusion;

import com.example.shorts_backend.dto.analysis.AnalyzerScore;
import com.example.shorts_backend.util.AnalyzerKind;

/**
 * Short labels explaining why a moment scored well.
 */
final class ReasonLabels {

    private ReasonLabels() {
    }

    static String label(AnalyzerKind kind, AnalyzerScore score) {
        return switch (kind) {
            case AUDIO -> "High audio energy";
            case MOTION -> "High motion";
            case SCENE -> "Visual interest";
            case FACES -> "Face detected";
            case SEMANTIC -> semanticLabel(score);
        };
    }

    private static String semanticLabel(AnalyzerScore score) {
        Object viral = score.metadata().get("viralPotential");
        Object description = score.metadata().get("description");
        if ("high".equals(viral) && description != null) {
            return "High viral potential: " + description;
        }
        Object type = score.metadata().get("contentType");
        if (type == null || "other".equals(type)) {
            return "Engaging content";
        }
        return "AI detected: " + type + " content";
    }
}
