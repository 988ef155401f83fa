package com.eyelevel.videosigning.service.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.eyelevel.videosigning.config.VideoSigningConfig;
import com.eyelevel.videosigning.dto.job.JobStatusResponse;
import com.eyelevel.videosigning.dto.job.SignedArtifact;
import com.eyelevel.videosigning.exception.ArtifactMissingException;
import com.eyelevel.videosigning.exception.ArtifactNotReadyException;
import com.eyelevel.videosigning.exception.apiclient.NotFoundException;
import com.eyelevel.videosigning.model.SignedVideo;
import com.eyelevel.videosigning.model.SigningStatus;
import com.eyelevel.videosigning.service.integrity.ContentHasher;
import com.eyelevel.videosigning.service.storage.StagingStorageService;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class JobQueryServiceTest {

    @TempDir Path tempDir;

    @Mock private JobRecordStore jobRecordStore;

    private StagingStorageService storage;
    private JobQueryService service;

    @BeforeEach
    void setUp() throws Exception {
        VideoSigningConfig config = new VideoSigningConfig();
        config.setStagingDir(tempDir.resolve("staging").toString());
        config.setArtifactDir(tempDir.resolve("out").toString());
        storage = new StagingStorageService(config, new ContentHasher(config));
        Files.createDirectories(storage.artifactDir());
        service = new JobQueryService(jobRecordStore, storage);
    }

    @Test
    void getStatus_unknownJobIsNotFound() {
        when(jobRecordStore.getById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getStatus(99L))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Video not found with ID: 99");
    }

    @Test
    void getStatus_exposesFailureDetail() {
        when(jobRecordStore.getById(4L)).thenReturn(Optional.of(job(4L, SigningStatus.FAILED, null,
                                                                    "Signing failed with exit code 3")));

        JobStatusResponse status = service.getStatus(4L);

        assertThat(status.jobId()).isEqualTo(4L);
        assertThat(status.status()).isEqualTo(SigningStatus.FAILED);
        assertThat(status.errorDetail()).isEqualTo("Signing failed with exit code 3");
        assertThat(status.outputName()).isNull();
        assertThat(status.originalName()).isEqualTo("clip.mp4");
    }

    @Test
    void getArtifact_processingJobIsNotReady() {
        when(jobRecordStore.getById(4L)).thenReturn(Optional.of(job(4L, SigningStatus.PROCESSING, null, null)));

        assertThatThrownBy(() -> service.getArtifact(4L))
                .isInstanceOf(ArtifactNotReadyException.class)
                .hasMessage("Video not yet signed. Current status: processing");
    }

    @Test
    void getArtifact_failedJobIsNotReady() {
        when(jobRecordStore.getById(4L)).thenReturn(Optional.of(job(4L, SigningStatus.FAILED, null, "boom")));

        assertThatThrownBy(() -> service.getArtifact(4L))
                .isInstanceOf(ArtifactNotReadyException.class)
                .hasMessageContaining("Current status: failed");
    }

    @Test
    void getArtifact_missingFileIsReportedAsNotFound() {
        when(jobRecordStore.getById(4L))
                .thenReturn(Optional.of(job(4L, SigningStatus.COMPLETED, "clip_signed_4.mp4", null)));

        assertThatThrownBy(() -> service.getArtifact(4L))
                .isInstanceOf(ArtifactMissingException.class)
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Signed video file not found");
    }

    @Test
    void getArtifact_returnsSignedFileAsMp4() throws Exception {
        Files.writeString(storage.artifactDir().resolve("clip_signed_4.mp4"), "signed bytes");
        when(jobRecordStore.getById(4L))
                .thenReturn(Optional.of(job(4L, SigningStatus.COMPLETED, "clip_signed_4.mp4", null)));

        SignedArtifact artifact = service.getArtifact(4L);

        assertThat(artifact.fileName()).isEqualTo("clip_signed_4.mp4");
        assertThat(artifact.contentType()).isEqualTo("video/mp4");
        assertThat(artifact.contentLength()).isEqualTo("signed bytes".length());
        assertThat(artifact.resource().getContentAsByteArray()).isEqualTo("signed bytes".getBytes());
    }

    private static SignedVideo job(Long id, SigningStatus status, String outputName, String errorDetail) {
        return SignedVideo.builder()
                          .id(id)
                          .originalName("clip.mp4")
                          .contentHash("ab".repeat(32))
                          .status(status)
                          .outputName(outputName)
                          .errorDetail(errorDetail)
                          .createdAt(LocalDateTime.now().minusMinutes(1))
                          .build();
    }
}
