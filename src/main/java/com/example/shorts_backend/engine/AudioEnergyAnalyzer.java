package com.example.shorts_backend.engine;

import com.example.shorts_backend.dto.analysis.AnalysisRequest;
import com.example.shorts_backend.dto.analysis.AnalyzerResult;
import com.example.shorts_backend.dto.analysis.AnalyzerScore;
import com.example.shorts_backend.dto.analysis.TimedScore;
import com.example.shorts_backend.engine.Interfaces.MediaSampler;
import com.example.shorts_backend.engine.Interfaces.SignalAnalyzer;
import com.example.shorts_backend.util.AnalyzerKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Scores loudness and sudden sound onsets. Each window gets its min-max normalized RMS on a 0-100
 * scale plus its normalized onset strength on a 0-50 scale, capped at 100.
 */
public class AudioEnergyAnalyzer implements SignalAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(AudioEnergyAnalyzer.class);
    static final int HOP = 512;
    private static final double EPS = 1e-6;

    private final MediaSampler sampler;
    private final int sampleRate;
    private final double windowSec;

    public AudioEnergyAnalyzer(MediaSampler sampler, int sampleRate, double windowSec) {
        this.sampler = sampler;
        this.sampleRate = sampleRate > 0 ? sampleRate : 22_050;
        this.windowSec = windowSec > 0 ? windowSec : 1.0;
    }

    @Override
    public AnalyzerKind kind() {
        return AnalyzerKind.AUDIO;
    }

    @Override
    public double sampleIntervalSec() {
        return windowSec;
    }

    @Override
    public AnalyzerResult analyze(AnalysisRequest request) throws Exception {
        if (!request.info().hasAudio()) {
            return AnalyzerResult.unavailable(kind(), "no audio stream");
        }
        Accumulator acc = new Accumulator(sampleRate, windowSec);
        sampler.streamPcm(request.mediaFile(), sampleRate, acc::accept);
        List<TimedScore> scores = acc.scores();
        LOGGER.debug("AUDIO jobId={} windows={}", request.jobId(), scores.size());
        return AnalyzerResult.of(kind(), scores);
    }

    /**
     * Collects per-window RMS and onset statistics from a PCM stream.
     */
    static final class Accumulator {
        private final int windowSamples;
        private final double windowSec;
        private final List<double[]> windows = new ArrayList<>(); // {sumSq, count, fluxSum, hops}

        private double sumSq;
        private long count;
        private double fluxSum;
        private int hops;

        private double hopSumSq;
        private int hopCount;
        private double prevLogEnergy = Double.NaN;

        Accumulator(int sampleRate, double windowSec) {
            this.windowSamples = (int) Math.max(1, Math.round(sampleRate * windowSec));
            this.windowSec = windowSec;
        }

        void accept(float[] samples, int n) {
            for (int i = 0; i < n; i++) {
                double s = samples[i];
                sumSq += s * s;
                count++;
                hopSumSq += s * s;
                hopCount++;
                if (hopCount == HOP) {
                    closeHop();
                }
                if (count == windowSamples) {
                    closeWindow();
                }
            }
        }

        private void closeHop() {
            double logEnergy = Math.log10(hopSumSq / hopCount + 1e-10);
            double flux = Double.isNaN(prevLogEnergy) ? 0.0 : Math.max(0.0, logEnergy - prevLogEnergy);
            prevLogEnergy = logEnergy;
            fluxSum += flux;
            hops++;
            hopSumSq = 0;
            hopCount = 0;
        }

        private void closeWindow() {
            windows.add(new double[]{sumSq, count, fluxSum, hops});
            sumSq = 0;
            count = 0;
            fluxSum = 0;
            hops = 0;
        }

        List<TimedScore> scores() {
            // keep a trailing partial window when it covers at least half a window
            if (count >= windowSamples / 2 && count > 0) {
                if (hopCount > 0) {
                    closeHop();
                }
                closeWindow();
            }
            int n = windows.size();
            if (n == 0) {
                return List.of();
            }
            double[] rms = new double[n];
            double[] onset = new double[n];
            for (int i = 0; i < n; i++) {
                double[] w = windows.get(i);
                rms[i] = Math.sqrt(w[0] / w[1]);
                onset[i] = w[3] == 0 ? 0.0 : w[2] / w[3];
            }
            double rmsMin = min(rms), rmsMax = max(rms);
            double onMin = min(onset), onMax = max(onset);

            List<TimedScore> out = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                double rmsNorm = (rms[i] - rmsMin) / (rmsMax - rmsMin + EPS) * 100.0;
                double onsetNorm = (onset[i] - onMin) / (onMax - onMin + EPS) * 50.0;
                double score = Math.min(100.0, rmsNorm + onsetNorm);
                out.add(new TimedScore(i * windowSec, new AnalyzerScore(score, Map.of("rms", rms[i], "onset", onset[i]))));
            }
            return out;
        }

        private static double min(double[] values) {
            double m = Double.POSITIVE_INFINITY;
            for (double v : values) m = Math.min(m, v);
            return m;
        }

        private static double max(double[] values) {
            double m = Double.NEGATIVE_INFINITY;
            for (double v : values) m = Math.max(m, v);
            return m;
        }
    }
}
