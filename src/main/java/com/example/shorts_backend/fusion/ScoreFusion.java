package com.example.shorts_backend.fusion;

import com.example.shorts_backend.dto.analysis.AnalyzerResult;
import com.example.shorts_backend.dto.analysis.AnalyzerScore;
import com.example.shorts_backend.dto.analysis.TimedScore;
import com.example.shorts_backend.util.AnalyzerKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Combines analyzer outputs into one engagement curve.
 *
 * <p>The grid has one point per whole second of media. Each analyzer contributes the sample nearest
 * to a grid point when it lies within that analyzer's tolerance: the configured base tolerance, or
 * half the analyzer's median sample spacing when that is wider. Equidistant samples resolve to the
 * earlier one. Points without a sample in range get no contribution from that analyzer.
 */
public class ScoreFusion {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScoreFusion.class);
    static final int MAX_REASONS_PER_POINT = 2;

    private final WeightTable weightTable;
    private final double baseToleranceSec;

    public ScoreFusion(WeightTable weightTable, double baseToleranceSec) {
        this.weightTable = weightTable;
        this.baseToleranceSec = Math.max(0.0, baseToleranceSec);
    }

    /**
     * @throws com.example.shorts_backend.exception.AnalysisException when no result is usable.
     */
    public EngagementCurve fuse(Collection<AnalyzerResult> results, double durationSec) {
        List<AnalyzerResult> usable = results.stream().filter(AnalyzerResult::usable).toList();
        Set<AnalyzerKind> kinds = usable.stream().map(AnalyzerResult::kind).collect(Collectors.toSet());
        Map<AnalyzerKind, Double> weights = weightTable.resolve(kinds);

        Map<AnalyzerKind, Track> tracks = new EnumMap<>(AnalyzerKind.class);
        for (AnalyzerResult r : usable) {
            if (weights.containsKey(r.kind())) {
                tracks.put(r.kind(), new Track(r.samples(), baseToleranceSec));
            }
        }

        int n = durationSec > 0 ? (int) Math.ceil(durationSec) : 0;
        List<CurvePoint> points = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            double t = i;
            double total = 0.0;
            List<CurvePoint.Reason> contributions = new ArrayList<>();
            for (Map.Entry<AnalyzerKind, Track> e : tracks.entrySet()) {
                AnalyzerScore score = e.getValue().nearest(t);
                if (score == null) {
                    continue;
                }
                double contribution = weights.get(e.getKey()) * score.value();
                total += contribution;
                if (contribution > 0.0) {
                    contributions.add(new CurvePoint.Reason(e.getKey(), ReasonLabels.label(e.getKey(), score), contribution));
                }
            }
            contributions.sort(Comparator.comparingDouble(CurvePoint.Reason::contribution).reversed()
                    .thenComparing(CurvePoint.Reason::kind));
            List<CurvePoint.Reason> top = contributions.size() > MAX_REASONS_PER_POINT
                    ? contributions.subList(0, MAX_REASONS_PER_POINT)
                    : contributions;
            points.add(new CurvePoint(t, AnalyzerScore.clamp(total), top));
        }

        LOGGER.debug("Fused curve points={} weights={}", n, weights.entrySet().stream()
                .map(e -> e.getKey().key() + "=" + String.format(Locale.ROOT, "%.3f", e.getValue()))
                .collect(Collectors.joining(",")));
        return new EngagementCurve(points, durationSec, weights);
    }

    /**
     * Samples of one analyzer in time order with nearest-sample lookup.
     */
    static final class Track {
        private final double[] times;
        private final AnalyzerScore[] scores;
        private final double tolerance;

        Track(List<TimedScore> samples, double baseTolerance) {
            this.times = new double[samples.size()];
            this.scores = new AnalyzerScore[samples.size()];
            for (int i = 0; i < samples.size(); i++) {
                times[i] = samples.get(i).timeSec();
                scores[i] = samples.get(i).score();
            }
            this.tolerance = Math.max(baseTolerance, medianGap(times) / 2.0);
        }

        AnalyzerScore nearest(double t) {
            if (times.length == 0) {
                return null;
            }
            int idx = Arrays.binarySearch(times, t);
            if (idx >= 0) {
                // first of equal timestamps
                while (idx > 0 && times[idx - 1] == t) {
                    idx--;
                }
                return scores[idx];
            }
            int insertion = -idx - 1;
            int best = -1;
            double bestDist = Double.POSITIVE_INFINITY;
            if (insertion - 1 >= 0) {
                best = insertion - 1;
                bestDist = t - times[best];
            }
            if (insertion < times.length && times[insertion] - t < bestDist) {
                best = insertion;
                bestDist = times[insertion] - t;
            }
            return bestDist <= tolerance ? scores[best] : null;
        }

        double tolerance() {
            return tolerance;
        }

        private static double medianGap(double[] times) {
            if (times.length < 2) {
                return 0.0;
            }
            double[] gaps = new double[times.length - 1];
            for (int i = 1; i < times.length; i++) {
                gaps[i - 1] = times[i] - times[i - 1];
            }
            Arrays.sort(gaps);
            return gaps[gaps.length / 2];
        }
    }
}
