package com.example.shorts_backend.dto.web;

import java.util.UUID;

public record SubmitJobResponse(UUID jobId, String stage) {
}
