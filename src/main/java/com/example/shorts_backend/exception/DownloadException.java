package com.example.shorts_backend.exception;

/**
 * Raised by a media fetcher when the source cannot be downloaded. The kind is surfaced on the failed
 * job as its error sub-kind.
 */
public class DownloadException extends RuntimeException {

    public enum Kind {
        UNAVAILABLE,
        PRIVATE,
        REGION_LOCKED,
        TOO_LONG,
        LIVE_STREAM,
        AUTH_REQUIRED,
        TIMEOUT,
        CANCELLED,
        FAILED
    }

    private final Kind kind;

    public DownloadException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DownloadException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
