package com.eyelevel.videosigning.controller;

import com.eyelevel.videosigning.dto.common.ApiResponse;
import com.eyelevel.videosigning.dto.health.HealthReport;
import com.eyelevel.videosigning.dto.job.JobStatusResponse;
import com.eyelevel.videosigning.dto.job.SignedArtifact;
import com.eyelevel.videosigning.dto.job.SubmissionResponse;
import com.eyelevel.videosigning.service.health.DependencyHealthService;
import com.eyelevel.videosigning.service.job.JobOrchestrationService;
import com.eyelevel.videosigning.service.job.JobQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST controller for video submission, job status, signed video download and dependency health.
 * JSON responses follow the standardized {@link ApiResponse} format.
 */
@Slf4j
@RestController
@RequestMapping("/videos/v1")
@RequiredArgsConstructor
@Validated
public class VideoSigningController implements VideoSigningApi {

    private final JobOrchestrationService jobOrchestrationService;
    private final JobQueryService jobQueryService;
    private final DependencyHealthService dependencyHealthService;

    @Override
    @PostMapping(value = "/uploads", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<SubmissionResponse>> uploadVideo(
            @RequestParam("file") final MultipartFile file,
            @RequestParam(value = "deviceInfo", required = false) final String deviceInfo) {

        log.info("Upload received for file: {}, size: {}", file.getOriginalFilename(), file.getSize());
        SubmissionResponse responseData = jobOrchestrationService.submit(file, deviceInfo);

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                             .body(ApiResponse.success(responseData, "Video uploaded successfully",
                                                       HttpStatus.ACCEPTED.value()));
    }

    @Override
    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<ApiResponse<JobStatusResponse>> getJobStatus(
            @PathVariable final Long jobId) {

        log.debug("Fetching status for jobId: {}", jobId);
        JobStatusResponse responseData = jobQueryService.getStatus(jobId);
        return ResponseEntity.ok(ApiResponse.success(responseData, "Job status retrieved successfully.",
                                                     HttpStatus.OK.value()));
    }

    @Override
    @GetMapping("/jobs/{jobId}/artifact")
    public ResponseEntity<Resource> downloadSignedVideo(
            @PathVariable final Long jobId) {

        log.info("Download requested for jobId: {}", jobId);
        SignedArtifact artifact = jobQueryService.getArtifact(jobId);

        return ResponseEntity.ok()
                             .contentType(MediaType.parseMediaType(artifact.contentType()))
                             .contentLength(artifact.contentLength())
                             .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                                                                                        .filename(artifact.fileName())
                                                                                        .build().toString())
                             .body(artifact.resource());
    }

    @Override
    @GetMapping("/health")
    public ResponseEntity<ApiResponse<HealthReport>> health() {
        HealthReport report = dependencyHealthService.healthCheck();
        return ResponseEntity.ok(ApiResponse.success(report, "Health check completed.", HttpStatus.OK.value()));
    }
}
