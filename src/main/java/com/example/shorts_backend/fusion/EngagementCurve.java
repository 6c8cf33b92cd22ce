package com.example.shorts_backend.fusion;

import com.example.shorts_backend.util.AnalyzerKind;

import java.util.List;
import java.util.Map;

/**
 * Fused engagement score over the whole media on a one second grid.
 *
 * @param points      grid points with strictly increasing timestamps.
 * @param durationSec media duration the curve spans.
 * @param weights     renormalized weights that produced the curve.
 */
public record EngagementCurve(List<CurvePoint> points, double durationSec, Map<AnalyzerKind, Double> weights) {

    public EngagementCurve {
        points = List.copyOf(points);
        weights = Map.copyOf(weights);
        for (int i = 1; i < points.size(); i++) {
            if (points.get(i).timeSec() <= points.get(i - 1).timeSec()) {
                throw new IllegalArgumentException("Curve timestamps must increase at index " + i);
            }
        }
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }
}
