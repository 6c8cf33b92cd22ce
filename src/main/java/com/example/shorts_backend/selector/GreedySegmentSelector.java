package com.example.shorts_backend.selector;

import com.example.shorts_backend.fusion.CurvePoint;
import com.example.shorts_backend.fusion.EngagementCurve;
import com.example.shorts_backend.model.Segment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Slides a clip-length window over the curve, ranks every window by its aggregate score and
 * accepts windows greedily as long as their starts stay at least {@code clip + gap} apart from all
 * windows accepted before. Equal scores go to the earlier window.
 */
@Component
public class GreedySegmentSelector implements SegmentSelector {
    private static final Logger LOGGER = LoggerFactory.getLogger(GreedySegmentSelector.class);
    private static final double EPS = 1e-9;

    private static final Comparator<ScoredWindow> RANKING = Comparator
            .comparingDouble(ScoredWindow::score).reversed()
            .thenComparingDouble(w -> w.window().startSec());

    @Override
    public List<Segment> select(EngagementCurve curve, SelectorConfig cfg) {
        List<ScoredWindow> candidates = candidates(curve, cfg);
        if (candidates.isEmpty() || cfg.clipCount() <= 0) {
            LOGGER.debug("GreedySegmentSelector duration={} clip={} no candidate fits", curve.durationSec(), cfg.clipDurationSec());
            return List.of();
        }
        candidates.sort(RANKING);

        List<ScoredWindow> accepted = new ArrayList<>();
        double separation = cfg.minStartSeparationSec();
        for (ScoredWindow candidate : candidates) {
            if (accepted.size() >= cfg.clipCount()) {
                break;
            }
            boolean clear = true;
            for (ScoredWindow a : accepted) {
                if (Math.abs(candidate.window().startSec() - a.window().startSec()) < separation - EPS) {
                    clear = false;
                    break;
                }
            }
            if (clear) {
                accepted.add(candidate);
                LOGGER.trace("selector accept rank={} start={} score={}", accepted.size(), candidate.window().startSec(),
                        String.format(Locale.ROOT, "%.4f", candidate.score()));
            }
        }

        List<Segment> segments = new ArrayList<>(accepted.size());
        for (int rank = 0; rank < accepted.size(); rank++) {
            ScoredWindow w = accepted.get(rank);
            segments.add(new Segment(0, rank + 1, w.window().startSec(), w.window().endSec(), w.score(), w.reasons(), null, null));
        }
        segments.sort(Comparator.comparingDouble(Segment::startSec));
        List<Segment> indexed = new ArrayList<>(segments.size());
        for (int i = 0; i < segments.size(); i++) {
            indexed.add(segments.get(i).withIndex(i + 1));
        }

        LOGGER.debug("GreedySegmentSelector candidates={} requested={} selected={} topScore={}",
                candidates.size(), cfg.clipCount(), indexed.size(),
                String.format(Locale.ROOT, "%.3f", accepted.get(0).score()));
        return indexed;
    }

    /**
     * All windows worth ranking. None exist when the media is shorter than one clip. A window cut
     * short by the end of the media is kept while it retains {@code minTailFraction} of the clip length;
     * under MEAN aggregation it is averaged over the full clip length.
     */
    List<ScoredWindow> candidates(EngagementCurve curve, SelectorConfig cfg) {
        double duration = curve.durationSec();
        double length = cfg.clipDurationSec();
        List<ScoredWindow> out = new ArrayList<>();
        if (curve.isEmpty() || duration + EPS < length) {
            return out;
        }
        double minLength = Math.max(EPS, length * cfg.minTailFraction());
        for (long k = 0; ; k++) {
            double start = k * cfg.strideSec();
            if (start >= duration) {
                break;
            }
            double end = Math.min(start + length, duration);
            if (end - start + EPS < minLength) {
                break;
            }
            out.add(score(curve, new Window(start, end), cfg));
        }
        return out;
    }

    private ScoredWindow score(EngagementCurve curve, Window window, SelectorConfig cfg) {
        List<CurvePoint> points = curve.points();
        double sum = 0.0;
        double max = 0.0;
        int count = 0;
        Map<String, Double> reasonWeight = new HashMap<>();
        for (int i = firstIndexAtOrAfter(points, window.startSec()); i < points.size(); i++) {
            CurvePoint p = points.get(i);
            if (p.timeSec() >= window.endSec() - EPS) {
                break;
            }
            sum += p.score();
            max = Math.max(max, p.score());
            count++;
            for (CurvePoint.Reason r : p.reasons()) {
                reasonWeight.merge(r.label(), r.contribution(), Double::sum);
            }
        }
        double raw = count == 0 ? 0.0 : (cfg.aggregation() == SelectorConfig.Aggregation.MAX ? max : sum / count);
        double span = window.endSec() - window.startSec();
        if (cfg.aggregation() == SelectorConfig.Aggregation.MEAN && span + EPS < cfg.clipDurationSec()) {
            // the part cut off by the end of the media counts as zero
            raw = raw * span / cfg.clipDurationSec();
        }
        List<String> reasons = reasonWeight.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue().reversed().thenComparing(Map.Entry.<String, Double>comparingByKey()))
                .limit(Math.max(0, cfg.maxReasons()))
                .map(Map.Entry::getKey)
                .toList();
        return new ScoredWindow(window, round(raw), reasons);
    }

    private static int firstIndexAtOrAfter(List<CurvePoint> points, double t) {
        int lo = 0, hi = points.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (points.get(mid).timeSec() < t - EPS) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP).doubleValue();
    }
}
