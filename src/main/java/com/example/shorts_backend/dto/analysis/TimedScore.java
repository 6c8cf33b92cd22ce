package com.example.shorts_backend.dto.analysis;

/**
 * @param timeSec sample timestamp in seconds from the start of the media.
 * @param score   normalized score for that timestamp.
 */
public record TimedScore(double timeSec, AnalyzerScore score) {
}
