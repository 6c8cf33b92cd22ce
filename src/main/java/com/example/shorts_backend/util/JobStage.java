package com.example.shorts_backend.util;

public enum JobStage {
    QUEUED,
    DOWNLOADING,
    ANALYZING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
