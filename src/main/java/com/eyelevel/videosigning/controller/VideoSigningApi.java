package com.eyelevel.videosigning.controller;

import com.eyelevel.videosigning.dto.common.ApiResponse;
import com.eyelevel.videosigning.dto.health.HealthReport;
import com.eyelevel.videosigning.dto.job.JobStatusResponse;
import com.eyelevel.videosigning.dto.job.SubmissionResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Positive;
import org.springframework.core.io.Resource;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.multipart.MultipartFile;

@Tag(name = "Video Signing", description = "Endpoints for uploading videos, tracking their signing jobs and downloading signed results.")
public interface VideoSigningApi {

    @Operation(summary = "Upload a Video for Signing",
            description = "Stages the uploaded video, records a new job and signs it in the background. Poll the job status to find out when the signed video is ready.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Video accepted and queued for signing.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Accepted", value = """
                                    {
                                        "displayMessage": "Video uploaded successfully",
                                        "response": {
                                            "jobId": 1,
                                            "status": "processing",
                                            "contentHash": "9f86d081884c7d659a2feaa0c55ad015a3bf4f1b2b0b822cd15d6c15b0f00a08"
                                        },
                                        "showMessage": true,
                                        "statusCode": 202
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Unsupported file format.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "500", description = "Internal Server Error - The upload could not be staged.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<SubmissionResponse>> uploadVideo(
            @Parameter(description = "The video file to sign.", required = true)
            @RequestParam("file") MultipartFile file,
            @Parameter(description = "Optional JSON metadata about the uploading device (OS, model, app version).",
                    example = "{\"os\":\"android\",\"model\":\"Pixel 8\"}")
            @RequestParam(value = "deviceInfo", required = false) String deviceInfo);

    @Operation(summary = "Get Job Status",
            description = "Returns the current state of a signing job. Failed jobs carry a descriptive errorDetail.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Job found.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - No job with this ID.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<JobStatusResponse>> getJobStatus(
            @Parameter(description = "The job ID returned by the upload.", required = true, example = "1")
            @PathVariable @Positive(message = "The 'jobId' must be a positive number.") Long jobId);

    @Operation(summary = "Download Signed Video",
            description = "Streams the signed video of a completed job as video/mp4.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "The signed video.",
                    content = @Content(mediaType = "video/mp4")),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - The video is not yet signed.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - Unknown job or missing signed file.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<Resource> downloadSignedVideo(
            @Parameter(description = "The job ID returned by the upload.", required = true, example = "1")
            @PathVariable @Positive(message = "The 'jobId' must be a positive number.") Long jobId);

    @Operation(summary = "Health Check",
            description = "Reports whether the signing library, signer executable and private key are present. Always returns 200.")
    ResponseEntity<ApiResponse<HealthReport>> health();
}
