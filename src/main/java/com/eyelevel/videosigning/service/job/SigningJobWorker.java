package com.eyelevel.videosigning.service.job;

import com.eyelevel.videosigning.exception.IntegrityComputationException;
import com.eyelevel.videosigning.service.integrity.ContentHasher;
import com.eyelevel.videosigning.service.signing.SigningInvoker;
import com.eyelevel.videosigning.service.signing.SigningOutcome;
import com.eyelevel.videosigning.service.storage.StagingStorageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Runs the background half of a signing job: verify the staged bytes, invoke the signer, record the
 * terminal status, and always remove the staged input.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SigningJobWorker {

    static final String OUTPUT_EXTENSION = ".mp4";
    private static final DateTimeFormatter OUTPUT_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ContentHasher contentHasher;
    private final SigningInvoker signingInvoker;
    private final JobRecordStore jobRecordStore;
    private final StagingStorageService stagingStorageService;

    /**
     * Processes one task to a terminal status. Never throws; every failure is recorded on the job.
     * The signed output is kept only when the job is recorded as COMPLETED.
     */
    public void process(final SigningTask task) {
        final String context = task.contextInfo();
        log.info("[{}] Background signing started for '{}'.", context, task.originalName());
        Path outputPath = null;
        boolean completed = false;
        try {
            verifyIntegrity(task);

            final String outputName = buildOutputName(task);
            outputPath = stagingStorageService.resolveArtifact(outputName);
            final SigningOutcome outcome = signingInvoker.sign(task.stagedInput(), outputPath, context);

            if (!outcome.isSuccess()) {
                recordFailure(task, outcome.errorDetail());
            } else if (!Files.isRegularFile(outputPath)) {
                recordFailure(task, "Signing failed: signer reported success but produced no output file");
            } else if (jobRecordStore.markCompleted(task.jobId(), outputName)) {
                completed = true;
                log.info("[{}] Successfully signed video: {}", context, outputName);
            } else {
                log.warn("[{}] Job already left PROCESSING; discarding signed output {}.", context, outputName);
            }
        } catch (IntegrityComputationException e) {
            recordFailure(task, "Integrity verification failed: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected error while signing.", context, e);
            recordFailure(task, "Processing failed: " + e.getMessage());
        } finally {
            stagingStorageService.discard(task.stagedInput());
            if (!completed) {
                stagingStorageService.discard(outputPath);
            }
        }
    }

    private void verifyIntegrity(final SigningTask task) {
        final String actual;
        try {
            actual = contentHasher.digest(task.stagedInput());
        } catch (IOException e) {
            throw new IntegrityComputationException("could not read staged input: " + e.getMessage(), e);
        }
        if (!actual.equals(task.contentHash())) {
            throw new IntegrityComputationException(String.format(
                    "staged input hash %s does not match recorded hash %s", actual, task.contentHash()));
        }
        log.debug("[{}] Staged input matches recorded SHA-256 {}.", task.contextInfo(), actual);
    }

    private void recordFailure(final SigningTask task, final String errorDetail) {
        log.error("[{}] Failed to sign video: {}", task.contextInfo(), errorDetail);
        try {
            jobRecordStore.markFailed(task.jobId(), errorDetail);
        } catch (RuntimeException e) {
            log.error("CRITICAL: Could not persist FAILED status for job ID {}. The record may stay PROCESSING "
                      + "until stale job recovery runs.", task.jobId(), e);
        }
    }

    /**
     * Builds {@code <base>_signed_<yyyyMMdd_HHmmss>_<jobId>.mp4}. The output is always MP4
     * regardless of the input container.
     */
    static String buildOutputName(final SigningTask task) {
        String baseName = FilenameUtils.getBaseName(task.originalName());
        baseName = baseName == null ? "" : baseName.replaceAll("[^A-Za-z0-9._-]", "_");
        if (!StringUtils.hasText(baseName)) {
            baseName = "video";
        }
        final String timestamp = ZonedDateTime.now(ZoneOffset.UTC).format(OUTPUT_TIMESTAMP);
        return baseName + "_signed_" + timestamp + "_" + task.jobId() + OUTPUT_EXTENSION;
    }
}
