package com.example.shorts_backend.dto.web;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * @param url       YouTube video URL.
 * @param duration  clip length in seconds; 60 when omitted.
 * @param clipCount number of clips; 5 when omitted.
 */
public record SubmitJobRequest(
        @NotBlank @Size(max = 2048) String url,
        Integer duration,
        @JsonAlias("clip_count") Integer clipCount
) {
}
