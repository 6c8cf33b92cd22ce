package com.example.shorts_backend.selector;

/**
 * Configuration for the {@link SegmentSelector}.
 *
 * @param clipDurationSec requested clip length in seconds.
 * @param clipCount       maximum number of clips to select.
 * @param minGapSec       extra distance required between two clip starts on top of the clip length.
 * @param strideSec       distance between consecutive candidate starts.
 * @param aggregation     how the curve is summarized over a window.
 * @param minTailFraction share of the clip length a window cut short by the media end must keep.
 * @param maxReasons      number of reason labels kept per segment.
 */
public record SelectorConfig(int clipDurationSec,
                             int clipCount,
                             double minGapSec,
                             double strideSec,
                             Aggregation aggregation,
                             double minTailFraction,
                             int maxReasons) {

    public enum Aggregation { MEAN, MAX }

    public SelectorConfig {
        if (clipDurationSec <= 0) {
            throw new IllegalArgumentException("clipDurationSec must be positive: " + clipDurationSec);
        }
        if (strideSec <= 0) {
            throw new IllegalArgumentException("strideSec must be positive: " + strideSec);
        }
        if (minGapSec < 0) {
            throw new IllegalArgumentException("minGapSec must not be negative: " + minGapSec);
        }
        aggregation = aggregation == null ? Aggregation.MEAN : aggregation;
        minTailFraction = Math.max(0.0, Math.min(1.0, minTailFraction));
    }

    /**
     * Default settings: 2 second minimum gap, 1 second stride, mean aggregation, tail windows down to
     * half the clip length, three reasons.
     */
    public static SelectorConfig defaults(int clipDurationSec, int clipCount) {
        return new SelectorConfig(clipDurationSec, clipCount, 2.0, 1.0, Aggregation.MEAN, 0.5, 3);
    }

    /** Minimum distance between the starts of two selected windows. */
    public double minStartSeparationSec() {
        return clipDurationSec + minGapSec;
    }
}
