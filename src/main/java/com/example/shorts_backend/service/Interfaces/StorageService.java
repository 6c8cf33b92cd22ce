package com.example.shorts_backend.service.Interfaces;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Local working storage: downloaded sources under {@code downloads/}, rendered clips under
 * {@code outputs/<jobId>/}.
 */
public interface StorageService {

    /** Full local path of a downloaded source, e.g. {@code downloads/<videoId>.mp4}. */
    Path resolveDownload(String objectKey);

    /** Full local path of a rendered artifact of a job. */
    Path resolveOutput(UUID jobId, String fileName);

    Path outputDir(UUID jobId);

    boolean existsDownload(String objectKey);

    void deleteDownload(String objectKey);

    /** Removes the output directory of a job with everything in it. */
    void deleteOutputs(UUID jobId);

    Path rootDownloads();

    Path rootOutputs();
}
