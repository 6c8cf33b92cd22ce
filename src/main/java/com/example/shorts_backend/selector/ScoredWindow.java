package com.example.shorts_backend.selector;

import java.util.List;

/**
 * Window paired with its aggregate score used for ranking.
 *
 * @param window  candidate span.
 * @param score   aggregate engagement score in [0,100], rounded to four decimals.
 * @param reasons strongest contributing signal labels within the span.
 */
public record ScoredWindow(Window window, double score, List<String> reasons) {
}
