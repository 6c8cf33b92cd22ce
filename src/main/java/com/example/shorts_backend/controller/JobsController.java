package com.example.shorts_backend.controller;

import com.example.shorts_backend.dto.web.DeleteJobResponse;
import com.example.shorts_backend.dto.web.JobStatusResponse;
import com.example.shorts_backend.dto.web.SubmitJobRequest;
import com.example.shorts_backend.dto.web.SubmitJobResponse;
import com.example.shorts_backend.model.Job;
import com.example.shorts_backend.service.JobService;
import jakarta.validation.Valid;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.UUID;

@RestController
@RequestMapping("/v1/jobs")
public class JobsController {
    private static final MediaType VIDEO_MP4 = MediaType.parseMediaType("video/mp4");

    private final JobService jobService;

    public JobsController(JobService jobService) {
        this.jobService = jobService;
    }

    @PostMapping
    public ResponseEntity<SubmitJobResponse> submit(@Valid @RequestBody SubmitJobRequest req) {
        Job job = jobService.submit(req.url(), req.duration(), req.clipCount());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new SubmitJobResponse(job.id(), job.stage().name()));
    }

    @GetMapping("/{id}")
    public JobStatusResponse get(@PathVariable UUID id) {
        return JobStatusResponse.from(jobService.get(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<DeleteJobResponse> delete(@PathVariable UUID id) {
        boolean deleted = jobService.delete(id);
        if (deleted) {
            return ResponseEntity.ok(new DeleteJobResponse(id, true, "Job deleted successfully"));
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new DeleteJobResponse(id, false, "Job cancellation requested"));
    }

    @GetMapping(value = "/{id}/clips/{index}", produces = "video/mp4")
    public ResponseEntity<FileSystemResource> clip(@PathVariable UUID id, @PathVariable int index) {
        Path file = jobService.clipFile(id, index);
        return ResponseEntity.ok()
                .contentType(VIDEO_MP4)
                .header(HttpHeaders.ACCEPT_RANGES, "bytes")
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"short_clip_" + index + ".mp4\"")
                .body(new FileSystemResource(file));
    }
}
