package com.example.shorts_backend.exception;

import java.util.UUID;

/**
 * Thrown inside a pipeline worker once it notices that its job was deleted.
 */
public class JobCancelledException extends RuntimeException {
    public JobCancelledException(UUID jobId) {
        super("Job cancelled: " + jobId);
    }
}
