package com.example.shorts_backend.dto.analysis;

import com.example.shorts_backend.util.AnalyzerKind;

import java.util.Comparator;
import java.util.List;

/**
 * Outcome of one analyzer for one job. Only {@link Status#OK} results take part in fusion.
 *
 * @param kind    analyzer that produced the result.
 * @param status  whether samples were produced.
 * @param samples samples ordered by timestamp; empty unless OK.
 * @param detail  reason for an unavailable result, otherwise null.
 */
public record AnalyzerResult(AnalyzerKind kind, Status status, List<TimedScore> samples, String detail) {

    public enum Status { OK, EMPTY, UNAVAILABLE }

    public AnalyzerResult {
        samples = samples == null ? List.of() : samples.stream()
                .sorted(Comparator.comparingDouble(TimedScore::timeSec))
                .toList();
    }

    public static AnalyzerResult of(AnalyzerKind kind, List<TimedScore> samples) {
        if (samples == null || samples.isEmpty()) {
            return new AnalyzerResult(kind, Status.EMPTY, List.of(), null);
        }
        return new AnalyzerResult(kind, Status.OK, samples, null);
    }

    public static AnalyzerResult unavailable(AnalyzerKind kind, String detail) {
        return new AnalyzerResult(kind, Status.UNAVAILABLE, List.of(), detail);
    }

    public boolean usable() {
        return status == Status.OK;
    }
}
