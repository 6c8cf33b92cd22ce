package com.example.shorts_backend.fusion;

import com.example.shorts_backend.dto.analysis.AnalyzerResult;
import com.example.shorts_backend.dto.analysis.AnalyzerScore;
import com.example.shorts_backend.dto.analysis.TimedScore;
import com.example.shorts_backend.exception.AnalysisException;
import com.example.shorts_backend.util.AnalyzerKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ScoreFusionTest {

    private final ScoreFusion fusion = new ScoreFusion(WeightTable.defaults(), 1.0);

    @Test
    void fusesWeightedScoresOnOneSecondGrid() {
        List<AnalyzerResult> results = List.of(
                perSecond(AnalyzerKind.AUDIO, 10, 80.0),
                perSecond(AnalyzerKind.MOTION, 10, 40.0),
                AnalyzerResult.unavailable(AnalyzerKind.SEMANTIC, "offline"));

        EngagementCurve curve = fusion.fuse(results, 9.5);

        assertThat(curve.size()).isEqualTo(10);
        assertThat(curve.points().get(0).timeSec()).isEqualTo(0.0);
        assertThat(curve.points().get(9).timeSec()).isEqualTo(9.0);
        double expected = (80.0 * 0.30 + 40.0 * 0.25) / 0.55;
        assertThat(curve.points()).allSatisfy(p -> assertThat(p.score()).isCloseTo(expected, within(1e-9)));
        assertThat(curve.weights()).containsOnlyKeys(AnalyzerKind.AUDIO, AnalyzerKind.MOTION);
        assertThat(curve.durationSec()).isEqualTo(9.5);
    }

    @Test
    void emptyResultsAreIgnored() {
        List<AnalyzerResult> results = List.of(
                perSecond(AnalyzerKind.AUDIO, 5, 50.0),
                AnalyzerResult.of(AnalyzerKind.FACES, List.of()));

        EngagementCurve curve = fusion.fuse(results, 5);

        assertThat(curve.weights()).containsOnlyKeys(AnalyzerKind.AUDIO);
        assertThat(curve.points()).allSatisfy(p -> assertThat(p.score()).isEqualTo(50.0));
    }

    @Test
    void noUsableResultFailsWithNoSignals() {
        List<AnalyzerResult> results = List.of(
                AnalyzerResult.unavailable(AnalyzerKind.AUDIO, "no audio"),
                AnalyzerResult.of(AnalyzerKind.MOTION, List.of()));

        assertThatThrownBy(() -> fusion.fuse(results, 30))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("No usable analysis signals");
    }

    @Test
    void sparseSamplesWidenToleranceToHalfTheMedianGap() {
        ScoreFusion.Track track = new ScoreFusion.Track(List.of(sample(0, 10), sample(10, 90)), 1.0);

        assertThat(track.tolerance()).isEqualTo(5.0);
        assertThat(track.nearest(4).value()).isEqualTo(10.0);
        assertThat(track.nearest(5).value()).as("equidistant resolves to the earlier sample").isEqualTo(10.0);
        assertThat(track.nearest(6).value()).isEqualTo(90.0);
        assertThat(track.nearest(15).value()).isEqualTo(90.0);
        assertThat(track.nearest(15.5)).isNull();
    }

    @Test
    void denseSamplesKeepBaseTolerance() {
        ScoreFusion.Track track = new ScoreFusion.Track(List.of(sample(0, 10), sample(1, 20), sample(2, 30)), 1.0);

        assertThat(track.tolerance()).isEqualTo(1.0);
        assertThat(track.nearest(3).value()).isEqualTo(30.0);
        assertThat(track.nearest(4)).isNull();
    }

    @Test
    void pointsWithoutNearbySampleGetNoContribution() {
        AnalyzerResult audio = AnalyzerResult.of(AnalyzerKind.AUDIO, List.of(sample(0, 60), sample(1, 60), sample(2, 60)));

        EngagementCurve curve = fusion.fuse(List.of(audio), 6);

        assertThat(curve.points()).extracting(CurvePoint::score).containsExactly(60.0, 60.0, 60.0, 60.0, 0.0, 0.0);
        assertThat(curve.points().get(5).reasons()).isEmpty();
    }

    @Test
    void keepsTwoStrongestReasonsWithKindOrderOnTies() {
        List<AnalyzerResult> results = List.of(
                perSecond(AnalyzerKind.FACES, 3, 60.0),
                perSecond(AnalyzerKind.SCENE, 3, 10.0),
                perSecond(AnalyzerKind.MOTION, 3, 60.0));

        CurvePoint point = fusion.fuse(results, 3).points().get(1);

        assertThat(point.reasons()).hasSize(ScoreFusion.MAX_REASONS_PER_POINT);
        assertThat(point.reasons()).extracting(CurvePoint.Reason::kind)
                .containsExactly(AnalyzerKind.MOTION, AnalyzerKind.FACES);
        assertThat(point.reasons()).extracting(CurvePoint.Reason::label)
                .containsExactly("High motion", "Face detected");
    }

    @Test
    void semanticReasonsCarryTheModelDescription() {
        AnalyzerScore viral = new AnalyzerScore(90, Map.of("viralPotential", "high", "description", "Crowd erupts",
                "contentType", "reaction"));
        AnalyzerScore plain = new AnalyzerScore(70, Map.of("viralPotential", "low", "contentType", "tutorial"));
        AnalyzerResult semantic = AnalyzerResult.of(AnalyzerKind.SEMANTIC, List.of(
                new TimedScore(0, viral), new TimedScore(3, plain)));

        EngagementCurve curve = fusion.fuse(List.of(semantic), 4);

        assertThat(curve.points().get(0).reasons().get(0).label()).isEqualTo("High viral potential: Crowd erupts");
        assertThat(curve.points().get(3).reasons().get(0).label()).isEqualTo("AI detected: tutorial content");
    }

    @Test
    void fusionIsDeterministic() {
        List<AnalyzerResult> results = new ArrayList<>();
        for (AnalyzerKind kind : AnalyzerKind.values()) {
            List<TimedScore> samples = new ArrayList<>();
            for (int t = 0; t < 120; t += 1 + kind.ordinal()) {
                samples.add(sample(t + 0.25 * kind.ordinal(), (t * 7 + kind.ordinal() * 13) % 101));
            }
            results.add(AnalyzerResult.of(kind, samples));
        }

        EngagementCurve first = fusion.fuse(results, 120);
        EngagementCurve second = fusion.fuse(List.copyOf(results), 120);

        assertThat(first).isEqualTo(second);
        assertThat(first.points()).allSatisfy(p -> assertThat(p.score()).isBetween(0.0, 100.0));
    }

    private static AnalyzerResult perSecond(AnalyzerKind kind, int seconds, double value) {
        List<TimedScore> samples = new ArrayList<>();
        for (int t = 0; t < seconds; t++) {
            samples.add(sample(t, value));
        }
        return AnalyzerResult.of(kind, samples);
    }

    private static TimedScore sample(double t, double value) {
        return new TimedScore(t, AnalyzerScore.of(value));
    }
}
