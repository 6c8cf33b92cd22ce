package com.example.shorts_backend.dto.web;

import com.example.shorts_backend.model.Segment;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SegmentView(
        int index,
        int rank,
        double startTime,
        double endTime,
        double duration,
        double score,
        List<String> reasons,
        boolean rendered,
        String renderError,
        String downloadUrl
) {

    public static SegmentView from(UUID jobId, Segment s) {
        String url = s.rendered() ? "/v1/jobs/" + jobId + "/clips/" + s.index() : null;
        return new SegmentView(s.index(), s.rank(), s.startSec(), s.endSec(), s.durationSec(), s.score(),
                s.reasons(), s.rendered(), s.renderError(), url);
    }
}
