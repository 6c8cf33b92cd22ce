package com.example.shorts_backend.dto.analysis;

import com.example.shorts_backend.engine.Interfaces.MediaSampler;

import java.nio.file.Path;
import java.util.UUID;

/**
 * @param jobId     job the analysis runs for, used for logging.
 * @param mediaFile downloaded source media.
 * @param info      probed stream information.
 */
public record AnalysisRequest(UUID jobId, Path mediaFile, MediaSampler.MediaInfo info) {

    public double durationSec() {
        return info.durationSec();
    }
}
