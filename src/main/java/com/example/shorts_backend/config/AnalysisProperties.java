package com.example.shorts_backend.config;

import com.example.shorts_backend.selector.SelectorConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tuning of the analyzers, score fusion and segment selection. Weight maps are keyed by analyzer key
 * ({@code semantic}, {@code audio}, {@code motion}, {@code scene}, {@code faces}).
 */
@ConfigurationProperties(prefix = "analysis")
public class AnalysisProperties {

    private double alignmentToleranceSec = 1.0;
    private Map<String, Double> weights = new LinkedHashMap<>(Map.of(
            "semantic", 0.30, "audio", 0.20, "motion", 0.20, "scene", 0.15, "faces", 0.15));
    private Map<String, Double> fallbackWeights = new LinkedHashMap<>(Map.of(
            "audio", 0.30, "motion", 0.25, "scene", 0.20, "faces", 0.25));

    private Audio audio = new Audio();
    private Frames motion = new Frames(0.5, 320, 180);
    private Frames scene = new Frames(0.5, 160, 90);
    private Faces faces = new Faces();
    private Semantic semantic = new Semantic();
    private Selection selection = new Selection();

    public double getAlignmentToleranceSec() { return alignmentToleranceSec; }
    public void setAlignmentToleranceSec(double alignmentToleranceSec) { this.alignmentToleranceSec = alignmentToleranceSec; }

    public Map<String, Double> getWeights() { return weights; }
    public void setWeights(Map<String, Double> weights) { this.weights = weights; }

    public Map<String, Double> getFallbackWeights() { return fallbackWeights; }
    public void setFallbackWeights(Map<String, Double> fallbackWeights) { this.fallbackWeights = fallbackWeights; }

    public Audio getAudio() { return audio; }
    public void setAudio(Audio audio) { this.audio = audio; }

    public Frames getMotion() { return motion; }
    public void setMotion(Frames motion) { this.motion = motion; }

    public Frames getScene() { return scene; }
    public void setScene(Frames scene) { this.scene = scene; }

    public Faces getFaces() { return faces; }
    public void setFaces(Faces faces) { this.faces = faces; }

    public Semantic getSemantic() { return semantic; }
    public void setSemantic(Semantic semantic) { this.semantic = semantic; }

    public Selection getSelection() { return selection; }
    public void setSelection(Selection selection) { this.selection = selection; }

    public static class Audio {
        private boolean enabled = true;
        private int sampleRate = 22_050;
        private double windowSec = 1.0;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getSampleRate() { return sampleRate; }
        public void setSampleRate(int sampleRate) { this.sampleRate = sampleRate; }

        public double getWindowSec() { return windowSec; }
        public void setWindowSec(double windowSec) { this.windowSec = windowSec; }
    }

    public static class Frames {
        private boolean enabled = true;
        private double intervalSec;
        private int width;
        private int height;

        public Frames() {
        }

        public Frames(double intervalSec, int width, int height) {
            this.intervalSec = intervalSec;
            this.width = width;
            this.height = height;
        }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public double getIntervalSec() { return intervalSec; }
        public void setIntervalSec(double intervalSec) { this.intervalSec = intervalSec; }

        public int getWidth() { return width; }
        public void setWidth(int width) { this.width = width; }

        public int getHeight() { return height; }
        public void setHeight(int height) { this.height = height; }
    }

    /**
     * Face detection runs in-process with OpenCV ({@code engine: opencv}) or through an external
     * command that prints a JSON report ({@code engine: command}).
     */
    public static class Faces {
        private boolean enabled = true;
        private double intervalSec = 1.0;
        private String engine = "opencv";
        private int width = 640;
        private int height = 360;
        private String cascadeFile;
        private String command = "face-detect";
        private long timeoutSeconds = 1200;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public double getIntervalSec() { return intervalSec; }
        public void setIntervalSec(double intervalSec) { this.intervalSec = intervalSec; }

        public String getEngine() { return engine; }
        public void setEngine(String engine) { this.engine = engine; }

        public int getWidth() { return width; }
        public void setWidth(int width) { this.width = width; }

        public int getHeight() { return height; }
        public void setHeight(int height) { this.height = height; }

        public String getCascadeFile() { return cascadeFile; }
        public void setCascadeFile(String cascadeFile) { this.cascadeFile = cascadeFile; }

        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }

        public long getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(long timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    public static class Semantic {
        private boolean enabled = true;
        private double intervalSec = 3.0;
        private int maxFrames = 50;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public double getIntervalSec() { return intervalSec; }
        public void setIntervalSec(double intervalSec) { this.intervalSec = intervalSec; }

        public int getMaxFrames() { return maxFrames; }
        public void setMaxFrames(int maxFrames) { this.maxFrames = maxFrames; }
    }

    public static class Selection {
        private double minGapSec = 2.0;
        private double strideSec = 1.0;
        private SelectorConfig.Aggregation aggregation = SelectorConfig.Aggregation.MEAN;
        private double minTailFraction = 0.5;
        private int maxReasons = 3;

        public double getMinGapSec() { return minGapSec; }
        public void setMinGapSec(double minGapSec) { this.minGapSec = minGapSec; }

        public double getStrideSec() { return strideSec; }
        public void setStrideSec(double strideSec) { this.strideSec = strideSec; }

        public SelectorConfig.Aggregation getAggregation() { return aggregation; }
        public void setAggregation(SelectorConfig.Aggregation aggregation) { this.aggregation = aggregation; }

        public double getMinTailFraction() { return minTailFraction; }
        public void setMinTailFraction(double minTailFraction) { this.minTailFraction = minTailFraction; }

        public int getMaxReasons() { return maxReasons; }
        public void setMaxReasons(int maxReasons) { this.maxReasons = maxReasons; }

        public SelectorConfig toSelectorConfig(int clipDurationSec, int clipCount) {
            return new SelectorConfig(clipDurationSec, clipCount, minGapSec, strideSec, aggregation, minTailFraction, maxReasons);
        }
    }
}
