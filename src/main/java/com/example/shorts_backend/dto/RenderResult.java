package com.example.shorts_backend.dto;

import java.nio.file.Path;

public record RenderResult(Path output, long sizeBytes, long tookMs) {
}
