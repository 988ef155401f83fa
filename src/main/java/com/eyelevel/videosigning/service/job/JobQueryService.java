package com.eyelevel.videosigning.service.job;

import com.eyelevel.videosigning.dto.job.JobStatusResponse;
import com.eyelevel.videosigning.dto.job.SignedArtifact;
import com.eyelevel.videosigning.exception.ArtifactMissingException;
import com.eyelevel.videosigning.exception.ArtifactNotReadyException;
import com.eyelevel.videosigning.exception.apiclient.NotFoundException;
import com.eyelevel.videosigning.model.SignedVideo;
import com.eyelevel.videosigning.model.SigningStatus;
import com.eyelevel.videosigning.service.storage.StagingStorageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Read-only lookups of job status and signed artifacts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobQueryService {

    static final String SIGNED_VIDEO_CONTENT_TYPE = "video/mp4";

    private final JobRecordStore jobRecordStore;
    private final StagingStorageService stagingStorageService;

    /**
     * @throws NotFoundException if no job has this ID.
     */
    public JobStatusResponse getStatus(final Long jobId) {
        return JobStatusResponse.from(findJob(jobId));
    }

    /**
     * Looks up the signed video of a completed job.
     *
     * @throws NotFoundException          if no job has this ID.
     * @throws ArtifactNotReadyException  if the job has not completed.
     * @throws ArtifactMissingException   if the job completed but its output file is gone.
     */
    public SignedArtifact getArtifact(final Long jobId) {
        final SignedVideo video = findJob(jobId);
        if (video.getStatus() != SigningStatus.COMPLETED) {
            log.info("Artifact requested for job ID {} in status {}.", jobId, video.getStatus());
            throw new ArtifactNotReadyException("Video not yet signed. Current status: " + video.getStatus().getValue());
        }

        final Path artifact = stagingStorageService.resolveArtifact(video.getOutputName());
        if (!Files.isRegularFile(artifact)) {
            log.error("Signed artifact for job ID {} is missing at {}.", jobId, artifact);
            throw new ArtifactMissingException("Signed video file not found");
        }
        try {
            return new SignedArtifact(video.getOutputName(), new FileSystemResource(artifact),
                                      SIGNED_VIDEO_CONTENT_TYPE, Files.size(artifact));
        } catch (IOException e) {
            log.error("Could not read signed artifact for job ID {} at {}.", jobId, artifact, e);
            throw new ArtifactMissingException("Signed video file not found");
        }
    }

    private SignedVideo findJob(final Long jobId) {
        return jobRecordStore.getById(jobId)
                             .orElseThrow(() -> new NotFoundException("Video not found with ID: " + jobId));
    }
}
