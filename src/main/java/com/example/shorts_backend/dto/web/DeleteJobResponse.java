package com.example.shorts_backend.dto.web;

import java.util.UUID;

public record DeleteJobResponse(UUID jobId, boolean deleted, String message) {
}
