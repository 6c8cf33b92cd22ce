package com.example.shorts_backend.engine;

import com.example.shorts_backend.dto.analysis.AnalysisRequest;
import com.example.shorts_backend.dto.analysis.AnalyzerResult;
import com.example.shorts_backend.dto.analysis.TimedScore;
import com.example.shorts_backend.engine.Interfaces.MediaSampler;
import com.example.shorts_backend.engine.Interfaces.MediaSampler.GrayFrame;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;

class MotionAnalyzerTest {

    private static final MediaSampler.FrameSpec SPEC = new MediaSampler.FrameSpec(0.5, 40, 30);

    @Test
    void scoresFlowBetweenConsecutiveFrames() throws Exception {
        MediaSampler sampler = framesOf(
                pattern(0.0, 0),
                pattern(0.5, 0),
                pattern(1.0, 1));
        MotionAnalyzer analyzer = new MotionAnalyzer(sampler, SPEC);

        AnalyzerResult result = analyzer.analyze(request(true));

        List<TimedScore> samples = result.samples();
        assertThat(samples).extracting(TimedScore::timeSec).containsExactly(0.5, 1.0);
        assertThat(samples.get(0).score().value()).isZero();
        double magnitude = (Double) samples.get(1).score().metadata().get("magnitude");
        assertThat(magnitude).isBetween(0.5, 2.0);
        assertThat(samples.get(1).score().value()).isCloseTo(magnitude * MotionAnalyzer.MAGNITUDE_SCALE, within(1e-9));
    }

    @Test
    void singleFrameYieldsEmptyResult() throws Exception {
        MotionAnalyzer analyzer = new MotionAnalyzer(framesOf(pattern(0.0, 0)), SPEC);

        assertThat(analyzer.analyze(request(true)).status()).isEqualTo(AnalyzerResult.Status.EMPTY);
    }

    @Test
    void audioOnlyMediaIsUnavailable() throws Exception {
        MotionAnalyzer analyzer = new MotionAnalyzer(mock(MediaSampler.class), SPEC);

        assertThat(analyzer.analyze(request(false)).status()).isEqualTo(AnalyzerResult.Status.UNAVAILABLE);
    }

    static MediaSampler framesOf(GrayFrame... frames) throws Exception {
        MediaSampler sampler = mock(MediaSampler.class);
        doAnswer(inv -> {
            Consumer<GrayFrame> consumer = inv.getArgument(2);
            for (GrayFrame f : frames) {
                consumer.accept(f);
            }
            return null;
        }).when(sampler).streamGrayFrames(any(), any(), any());
        return sampler;
    }

    /** Smooth two-dimensional texture shifted right by {@code shift} pixels. */
    static GrayFrame pattern(double t, int shift) {
        int w = SPEC.width();
        int h = SPEC.height();
        byte[] px = new byte[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                double v = 128 + 50 * Math.sin((x - shift) / 4.0) + 50 * Math.sin(y / 5.0);
                px[y * w + x] = (byte) Math.round(v);
            }
        }
        return new GrayFrame(t, w, h, px);
    }

    private static AnalysisRequest request(boolean video) {
        MediaSampler.MediaInfo info = video
                ? new MediaSampler.MediaInfo(10, 1920, 1080, 30, true)
                : new MediaSampler.MediaInfo(10, 0, 0, 0, true);
        return new AnalysisRequest(UUID.randomUUID(), Path.of("video.mp4"), info);
    }
}
