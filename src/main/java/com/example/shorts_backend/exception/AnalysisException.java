package com.example.shorts_backend.exception;

public class AnalysisException extends RuntimeException {

    public static final String NO_SIGNALS = "NO_SIGNALS";
    public static final String MEDIA_UNREADABLE = "MEDIA_UNREADABLE";

    private final String subKind;

    public AnalysisException(String subKind, String message) {
        super(message);
        this.subKind = subKind;
    }

    public AnalysisException(String subKind, String message, Throwable cause) {
        super(message, cause);
        this.subKind = subKind;
    }

    public String getSubKind() {
        return subKind;
    }
}
