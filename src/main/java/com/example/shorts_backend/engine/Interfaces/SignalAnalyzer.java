package com.example.shorts_backend.engine.Interfaces;

import com.example.shorts_backend.dto.analysis.AnalysisRequest;
import com.example.shorts_backend.dto.analysis.AnalyzerResult;
import com.example.shorts_backend.util.AnalyzerKind;

/**
 * One engagement signal. Implementations sample the media at their own interval and return scores
 * normalized to [0,100].
 */
public interface SignalAnalyzer {

    AnalyzerKind kind();

    /** Seconds between two samples. */
    double sampleIntervalSec();

    /**
     * Checked once per job before analysis starts. An analyzer that reports {@code false} is not
     * invoked and counts as unavailable for that job.
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Scores the media. Throwing marks the analyzer unavailable for the whole job.
     */
    AnalyzerResult analyze(AnalysisRequest request) throws Exception;
}
