package com.example.shorts_backend.engine.Interfaces;

import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Decodes media into the raw material analyzers work on. Frames and audio are streamed so that a
 * multi-hour source never has to fit in memory.
 */
public interface MediaSampler {

    MediaInfo probe(Path mediaFile) throws Exception;

    /**
     * Streams grayscale frames taken every {@code spec.intervalSec()} seconds, scaled to the spec size.
     */
    void streamGrayFrames(Path mediaFile, FrameSpec spec, Consumer<GrayFrame> consumer) throws Exception;

    /**
     * Streams mono PCM samples in [-1,1] at {@code sampleRate}. Chunks arrive in order.
     */
    void streamPcm(Path mediaFile, int sampleRate, PcmConsumer consumer) throws Exception;

    /**
     * Grabs a single JPEG frame at {@code timeSec}, scaled down to at most {@code maxWidth} pixels wide.
     */
    byte[] extractJpeg(Path mediaFile, double timeSec, int maxWidth) throws Exception;

    /**
     * @param durationSec media duration in seconds.
     * @param width       video width in pixels, 0 for audio-only media.
     * @param height      video height in pixels, 0 for audio-only media.
     * @param fps         average frame rate, 0 when unknown.
     * @param hasAudio    whether an audio stream is present.
     */
    record MediaInfo(double durationSec, int width, int height, double fps, boolean hasAudio) {
        public boolean hasVideo() {
            return width > 0 && height > 0;
        }
    }

    record FrameSpec(double intervalSec, int width, int height) {
    }

    /**
     * @param timeSec timestamp of the frame.
     * @param pixels  8-bit luma values, row-major, {@code width * height} long.
     */
    record GrayFrame(double timeSec, int width, int height, byte[] pixels) {
        public int luma(int x, int y) {
            return pixels[y * width + x] & 0xFF;
        }
    }

    @FunctionalInterface
    interface PcmConsumer {
        void accept(float[] samples, int count);
    }
}
