package com.example.shorts_backend.engine.Interfaces;

import com.example.shorts_backend.dto.RenderOptions;
import com.example.shorts_backend.dto.RenderResult;

import java.nio.file.Path;

public interface ClipRenderEngine {
    RenderResult render(Path mediaFile, MediaSampler.MediaInfo source, double startSec, double endSec,
                        Path target, RenderOptions options) throws Exception;
}
