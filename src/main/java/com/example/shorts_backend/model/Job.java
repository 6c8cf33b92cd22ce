package com.example.shorts_backend.model;

import com.example.shorts_backend.util.JobStage;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Immutable snapshot of a clip generation job. Every state change produces a new instance, so a
 * reader holding a snapshot never observes a half-applied update.
 *
 * <p>Transitions follow {@code QUEUED → DOWNLOADING → ANALYZING → PROCESSING → COMPLETED}, with
 * {@code FAILED} reachable from any non-terminal stage. Progress never decreases and a terminal
 * snapshot rejects further changes.
 */
public record Job(UUID id,
                  String sourceUrl,
                  String videoId,
                  int clipDurationSec,
                  int clipCount,
                  JobStage stage,
                  int progress,
                  String message,
                  List<Segment> segments,
                  JobError error,
                  Path mediaPath,
                  Instant createdAt,
                  Instant updatedAt,
                  Instant completedAt) {

    public Job {
        segments = segments == null ? null : List.copyOf(segments);
    }

    public static Job queued(UUID id, String sourceUrl, String videoId, int clipDurationSec, int clipCount, Instant now) {
        return new Job(id, sourceUrl, videoId, clipDurationSec, clipCount, JobStage.QUEUED, 0,
                "Job queued for processing", null, null, null, now, now, null);
    }

    public boolean isTerminal() {
        return stage.isTerminal();
    }

    /**
     * Moves the job to {@code next}. Stages only move forward; progress is kept at least at its
     * current value.
     */
    public Job advance(JobStage next, int newProgress, String newMessage, Instant now) {
        requireActive();
        if (next.isTerminal()) {
            throw new IllegalStateException("Use complete/fail for terminal stage " + next);
        }
        if (next.ordinal() < stage.ordinal()) {
            throw new IllegalStateException("Stage cannot move back from " + stage + " to " + next);
        }
        return new Job(id, sourceUrl, videoId, clipDurationSec, clipCount, next, monotonic(newProgress),
                newMessage, segments, error, mediaPath, createdAt, now, null);
    }

    public Job withProgress(int newProgress, String newMessage, Instant now) {
        requireActive();
        return new Job(id, sourceUrl, videoId, clipDurationSec, clipCount, stage, monotonic(newProgress),
                newMessage != null ? newMessage : message, segments, error, mediaPath, createdAt, now, null);
    }

    public Job withMediaPath(Path path, Instant now) {
        requireActive();
        return new Job(id, sourceUrl, videoId, clipDurationSec, clipCount, stage, progress, message,
                segments, error, path, createdAt, now, null);
    }

    public Job complete(List<Segment> result, String finalMessage, Instant now) {
        requireActive();
        return new Job(id, sourceUrl, videoId, clipDurationSec, clipCount, JobStage.COMPLETED, 100,
                finalMessage, result, null, mediaPath, createdAt, now, now);
    }

    /** Progress is frozen at its last value. */
    public Job fail(JobError failure, Instant now) {
        requireActive();
        return new Job(id, sourceUrl, videoId, clipDurationSec, clipCount, JobStage.FAILED, progress,
                failure.message(), segments, failure, mediaPath, createdAt, now, now);
    }

    private int monotonic(int candidate) {
        int bounded = Math.max(0, Math.min(100, candidate));
        return Math.max(progress, bounded);
    }

    private void requireActive() {
        if (stage.isTerminal()) {
            throw new IllegalStateException("Job " + id + " already " + stage);
        }
    }
}
