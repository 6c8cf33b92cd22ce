package com.example.shorts_backend.dto.web;

import com.example.shorts_backend.model.Job;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Status surface polled by clients. {@code segments} stays null until the job completed and
 * {@code error} is null unless it failed.
 */
public record JobStatusResponse(
        UUID jobId,
        String stage,
        int progress,
        String message,
        List<SegmentView> segments,
        ErrorView error,
        Instant createdAt,
        Instant updatedAt,
        Instant completedAt
) {

    public static JobStatusResponse from(Job job) {
        List<SegmentView> segments = job.segments() == null ? null
                : job.segments().stream().map(s -> SegmentView.from(job.id(), s)).toList();
        return new JobStatusResponse(job.id(), job.stage().name(), job.progress(), job.message(), segments,
                ErrorView.from(job.error()), job.createdAt(), job.updatedAt(), job.completedAt());
    }
}
