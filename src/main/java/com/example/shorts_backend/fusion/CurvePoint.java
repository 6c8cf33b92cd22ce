package com.example.shorts_backend.fusion;

import com.example.shorts_backend.util.AnalyzerKind;

import java.util.List;

/**
 * @param timeSec timestamp on the fusion grid.
 * @param score   fused engagement score in [0,100].
 * @param reasons strongest contributing signals, strongest first.
 */
public record CurvePoint(double timeSec, double score, List<Reason> reasons) {

    public CurvePoint {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    /**
     * @param kind         analyzer behind the reason.
     * @param label        short human readable label.
     * @param contribution weighted score the analyzer added to the point.
     */
    public record Reason(AnalyzerKind kind, String label, double contribution) {
    }
}
