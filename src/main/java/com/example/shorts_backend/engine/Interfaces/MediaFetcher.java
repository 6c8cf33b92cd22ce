package com.example.shorts_backend.engine.Interfaces;

import java.nio.file.Path;
import java.util.function.BooleanSupplier;

/**
 * Downloads a source video to local storage.
 */
public interface MediaFetcher {

    /**
     * @param url      validated source URL.
     * @param target   file the media must end up in.
     * @param listener receives download percentages in [0,100]; may be called from another thread.
     * @param cancelled polled while the download runs; once true the download is stopped and
     *                  {@code DownloadException} of kind {@code CANCELLED} is thrown.
     * @return the downloaded media.
     * @throws com.example.shorts_backend.exception.DownloadException when the source cannot be fetched.
     */
    FetchedMedia fetch(String url, Path target, ProgressListener listener, BooleanSupplier cancelled);

    record FetchedMedia(Path file, String title, double durationSec) {
    }

    @FunctionalInterface
    interface ProgressListener {
        void onProgress(double percent);
    }
}
