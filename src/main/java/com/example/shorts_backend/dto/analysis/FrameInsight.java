package com.example.shorts_backend.dto.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Locale;
import java.util.Map;

/**
 * What a vision model reported about a single frame.
 *
 * @param baseScore      model's own engagement rating in [0,100].
 * @param description    short description of the frame.
 * @param contentType    one of action, reaction, tutorial, entertainment, other.
 * @param hasPerson      whether a person is visible.
 * @param hasText        whether on-screen text is visible.
 * @param mood           free-form mood label.
 * @param viralPotential one of high, medium, low.
 */
public record FrameInsight(double baseScore,
                           String description,
                           String contentType,
                           boolean hasPerson,
                           boolean hasText,
                           String mood,
                           String viralPotential) {

    public static final FrameInsight NEUTRAL = new FrameInsight(50, "Analysis unavailable", "other", false, false, "neutral", "low");

    private static final Map<String, Integer> VIRAL_BONUS = Map.of("high", 15, "medium", 5, "low", 0);
    private static final Map<String, Integer> CONTENT_BONUS = Map.of(
            "reaction", 12,
            "action", 10,
            "entertainment", 10,
            "tutorial", 8,
            "other", 0);

    /** {@code min(100, baseScore + viral bonus + content type bonus)}. */
    public double engagementScore() {
        double viral = VIRAL_BONUS.getOrDefault(normalize(viralPotential), 0);
        double content = CONTENT_BONUS.getOrDefault(normalize(contentType), 0);
        return Math.min(100.0, AnalyzerScore.clamp(baseScore) + viral + content);
    }

    public boolean highViralPotential() {
        return "high".equals(normalize(viralPotential));
    }

    /**
     * Extracts the first JSON object from a free-text model reply. Replies without a parsable object
     * yield {@link #NEUTRAL}.
     */
    public static FrameInsight parse(String reply, ObjectMapper mapper) {
        if (reply == null) {
            return NEUTRAL;
        }
        int start = reply.indexOf('{');
        int end = reply.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return NEUTRAL;
        }
        JsonNode node;
        try {
            node = mapper.readTree(reply.substring(start, end + 1));
        } catch (Exception e) {
            return NEUTRAL;
        }
        if (node == null || !node.isObject()) {
            return NEUTRAL;
        }
        double score = node.path("score").isNumber()
                ? node.path("score").asDouble()
                : parseDouble(node.path("score").asText(null), 50);
        return new FrameInsight(
                AnalyzerScore.clamp(score),
                node.path("description").asText("Engaging content"),
                normalize(node.path("content_type").asText("other")),
                node.path("has_person").asBoolean(false),
                node.path("has_text").asBoolean(false),
                normalize(node.path("mood").asText("neutral")),
                normalize(node.path("viral_potential").asText("low")));
    }

    private static double parseDouble(String raw, double fallback) {
        if (raw == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
