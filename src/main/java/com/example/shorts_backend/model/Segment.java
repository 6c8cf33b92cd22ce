package com.example.shorts_backend.model;

import java.nio.file.Path;
import java.util.List;

/**
 * A selected clip window of the source media.
 *
 * @param index       1-based position in chronological order.
 * @param rank        1-based position in descending score order.
 * @param startSec    start offset in seconds.
 * @param endSec      end offset in seconds.
 * @param score       aggregate engagement score in [0,100].
 * @param reasons     labels of the signals that contributed most, strongest first.
 * @param output      rendered clip, null until rendering succeeds.
 * @param renderError failure message when rendering failed, otherwise null.
 */
public record Segment(int index,
                      int rank,
                      double startSec,
                      double endSec,
                      double score,
                      List<String> reasons,
                      Path output,
                      String renderError) {

    public Segment {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public double durationSec() {
        return endSec - startSec;
    }

    public boolean rendered() {
        return output != null;
    }

    public Segment withIndex(int newIndex) {
        return new Segment(newIndex, rank, startSec, endSec, score, reasons, output, renderError);
    }

    public Segment withOutput(Path rendered) {
        return new Segment(index, rank, startSec, endSec, score, reasons, rendered, null);
    }

    public Segment withRenderError(String error) {
        return new Segment(index, rank, startSec, endSec, score, reasons, null, error);
    }
}
