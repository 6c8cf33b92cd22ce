package com.example.shorts_backend.fusion;

import com.example.shorts_backend.exception.AnalysisException;
import com.example.shorts_backend.util.AnalyzerKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Per-analyzer fusion weights. Two base tables exist: the default one used while the semantic
 * analyzer takes part, and a fallback one for runs without it. Whatever base table applies is
 * restricted to the analyzers that produced scores and renormalized to sum to 1.0, keeping the
 * ratios between the remaining weights.
 */
public final class WeightTable {

    public static final Map<AnalyzerKind, Double> DEFAULT_WEIGHTS = Collections.unmodifiableMap(new EnumMap<>(Map.of(
            AnalyzerKind.SEMANTIC, 0.30,
            AnalyzerKind.AUDIO, 0.20,
            AnalyzerKind.MOTION, 0.20,
            AnalyzerKind.SCENE, 0.15,
            AnalyzerKind.FACES, 0.15)));

    public static final Map<AnalyzerKind, Double> FALLBACK_WEIGHTS = Collections.unmodifiableMap(new EnumMap<>(Map.of(
            AnalyzerKind.AUDIO, 0.30,
            AnalyzerKind.MOTION, 0.25,
            AnalyzerKind.SCENE, 0.20,
            AnalyzerKind.FACES, 0.25)));

    private final Map<AnalyzerKind, Double> withSemantic;
    private final Map<AnalyzerKind, Double> withoutSemantic;

    public WeightTable(Map<AnalyzerKind, Double> withSemantic, Map<AnalyzerKind, Double> withoutSemantic) {
        this.withSemantic = validated(withSemantic);
        this.withoutSemantic = validated(withoutSemantic);
    }

    public static WeightTable defaults() {
        return new WeightTable(DEFAULT_WEIGHTS, FALLBACK_WEIGHTS);
    }

    /**
     * @param available analyzers that produced usable scores for this run.
     * @return weights of the available analyzers, summing to 1.0.
     * @throws AnalysisException when no available analyzer carries weight.
     */
    public Map<AnalyzerKind, Double> resolve(Set<AnalyzerKind> available) {
        Map<AnalyzerKind, Double> base = available.contains(AnalyzerKind.SEMANTIC) ? withSemantic : withoutSemantic;
        EnumMap<AnalyzerKind, Double> active = new EnumMap<>(AnalyzerKind.class);
        double sum = 0.0;
        for (AnalyzerKind kind : available) {
            double w = base.getOrDefault(kind, 0.0);
            if (w > 0.0) {
                active.put(kind, w);
                sum += w;
            }
        }
        if (active.isEmpty() || sum <= 0.0) {
            throw new AnalysisException(AnalysisException.NO_SIGNALS, "No usable analysis signals: every analyzer was unavailable");
        }
        final double total = sum;
        active.replaceAll((kind, w) -> w / total);
        return Collections.unmodifiableMap(active);
    }

    public Map<AnalyzerKind, Double> withSemantic() {
        return withSemantic;
    }

    public Map<AnalyzerKind, Double> withoutSemantic() {
        return withoutSemantic;
    }

    private static Map<AnalyzerKind, Double> validated(Map<AnalyzerKind, Double> weights) {
        if (weights == null || weights.isEmpty()) {
            throw new IllegalArgumentException("Weight table must not be empty");
        }
        EnumMap<AnalyzerKind, Double> copy = new EnumMap<>(AnalyzerKind.class);
        weights.forEach((kind, w) -> {
            if (w == null || Double.isNaN(w) || w < 0.0 || w > 1.0) {
                throw new IllegalArgumentException("Weight for " + kind + " must be within [0,1]: " + w);
            }
            copy.put(kind, w);
        });
        return Collections.unmodifiableMap(copy);
    }
}
