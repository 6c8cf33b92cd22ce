package com.example.shorts_backend.model;

import com.example.shorts_backend.util.ErrorKind;

/**
 * @param kind    failure category.
 * @param subKind finer classification, e.g. {@code PRIVATE} for a download or {@code NO_SIGNALS} for analysis; may be null.
 * @param message human readable explanation.
 */
public record JobError(ErrorKind kind, String subKind, String message) {
}
