package com.eyelevel.videosigning.dto.job;

import com.eyelevel.videosigning.model.SignedVideo;
import com.eyelevel.videosigning.model.SigningStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;

/**
 * The externally visible view of a job record.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(Long jobId,
                                String originalName,
                                String contentHash,
                                LocalDateTime createdAt,
                                LocalDateTime completedAt,
                                SigningStatus status,
                                String outputName,
                                String errorDetail) {

    public static JobStatusResponse from(final SignedVideo video) {
        return new JobStatusResponse(video.getId(), video.getOriginalName(), video.getContentHash(),
                                     video.getCreatedAt(), video.getCompletedAt(), video.getStatus(),
                                     video.getOutputName(), video.getErrorDetail());
    }
}
