package com.example.shorts_backend.dto;

/**
 * Encoding settings for a vertical clip.
 */
public record RenderOptions(int width,
                            int height,
                            int crf,
                            String preset,
                            String audioBitrate) {

    public static final RenderOptions DEFAULT = new RenderOptions(1080, 1920, 23, "medium", "128k");
    public static final RenderOptions LOW = new RenderOptions(720, 1280, 23, "medium", "128k");
}
