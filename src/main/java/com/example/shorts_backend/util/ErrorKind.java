package com.example.shorts_backend.util;

/**
 * Failure categories reported on a failed job. Input validation never reaches a job: it is
 * rejected before the job is created.
 */
public enum ErrorKind {
    DOWNLOAD,
    ANALYSIS,
    RENDER,
    SYSTEM,
    CANCELLED
}
