package com.example.shorts_backend.selector;

import com.example.shorts_backend.fusion.EngagementCurve;
import com.example.shorts_backend.model.Segment;

import java.util.List;

/**
 * Picks the clip windows of a media item from its engagement curve.
 */
public interface SegmentSelector {
    /**
     * Selects at most {@code cfg.clipCount()} non-overlapping windows.
     *
     * @param curve fused engagement curve of the media.
     * @param cfg   selector configuration to apply.
     * @return segments ordered by start time, each carrying its score rank and chronological index.
     */
    List<Segment> select(EngagementCurve curve, SelectorConfig cfg);
}
