package com.example.shorts_backend.dto.web;

import com.example.shorts_backend.model.JobError;

public record ErrorView(String kind, String subKind, String message) {

    public static ErrorView from(JobError error) {
        return error == null ? null : new ErrorView(error.kind().name(), error.subKind(), error.message());
    }
}
