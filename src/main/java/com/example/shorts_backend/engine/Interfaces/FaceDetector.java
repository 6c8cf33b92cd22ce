package com.example.shorts_backend.engine.Interfaces;

import java.nio.file.Path;
import java.util.List;

/**
 * Locates faces in frames sampled from a video.
 */
public interface FaceDetector {

    boolean isAvailable();

    List<FrameFaces> detect(Path mediaFile, double intervalSec) throws Exception;

    record FaceBox(int x, int y, int width, int height) {
        public long area() {
            return (long) Math.max(0, width) * Math.max(0, height);
        }
    }

    record FrameFaces(double timeSec, int frameWidth, int frameHeight, List<FaceBox> faces) {
        public FrameFaces {
            faces = faces == null ? List.of() : List.copyOf(faces);
        }
    }
}
