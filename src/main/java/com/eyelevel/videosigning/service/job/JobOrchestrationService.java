package com.eyelevel.videosigning.service.job;

import com.eyelevel.videosigning.dto.job.SubmissionResponse;
import com.eyelevel.videosigning.exception.StagingException;
import com.eyelevel.videosigning.exception.UnsupportedVideoFormatException;
import com.eyelevel.videosigning.model.SignedVideo;
import com.eyelevel.videosigning.model.SigningStatus;
import com.eyelevel.videosigning.service.storage.StagingStorageService;
import com.eyelevel.videosigning.service.storage.StagingStorageService.StagedFile;
import com.eyelevel.videosigning.service.validation.FormatValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * Accepts video submissions and hands them to the background signing pool. This service is the
 * primary entry point for the API layer.
 * <p>
 * Acceptance is synchronous: validate the format, stage the bytes, create the job record. Staging runs
 * before any transaction is opened; the transaction covers only the record insert. Signing is scheduled
 * only after that transaction commits, so a worker never sees a missing record.
 */
@Slf4j
@Service
public class JobOrchestrationService {

    private final FormatValidator formatValidator;
    private final StagingStorageService stagingStorageService;
    private final DeviceInfoNormalizer deviceInfoNormalizer;
    private final JobRecordStore jobRecordStore;
    private final SigningJobWorker signingJobWorker;
    private final AsyncTaskExecutor signingTaskExecutor;
    private final TransactionTemplate txTemplate;

    public JobOrchestrationService(FormatValidator formatValidator,
                                   StagingStorageService stagingStorageService,
                                   DeviceInfoNormalizer deviceInfoNormalizer,
                                   JobRecordStore jobRecordStore,
                                   SigningJobWorker signingJobWorker,
                                   @Qualifier("signingTaskExecutor") AsyncTaskExecutor signingTaskExecutor,
                                   PlatformTransactionManager txManager) {
        this.formatValidator = formatValidator;
        this.stagingStorageService = stagingStorageService;
        this.deviceInfoNormalizer = deviceInfoNormalizer;
        this.jobRecordStore = jobRecordStore;
        this.signingJobWorker = signingJobWorker;
        this.signingTaskExecutor = signingTaskExecutor;
        this.txTemplate = new TransactionTemplate(txManager);
    }

    /**
     * Accepts an uploaded video for signing.
     *
     * @param file       The uploaded video.
     * @param deviceInfo Optional JSON metadata about the uploading device.
     * @return The new job's ID, its PROCESSING status and the content hash of the upload.
     * @throws UnsupportedVideoFormatException if the extension is not accepted; no record is created.
     * @throws StagingException                if the bytes cannot be staged; no record is created.
     */
    public SubmissionResponse submit(final MultipartFile file, final String deviceInfo) {
        final String originalName = file.getOriginalFilename();
        log.info("Received submission '{}' ({} bytes).", originalName, file.getSize());

        if (!formatValidator.isSupported(originalName)) {
            log.warn("Rejecting '{}': unsupported format.", originalName);
            throw new UnsupportedVideoFormatException(originalName, formatValidator.supportedFormats());
        }

        final StagedFile staged;
        try {
            staged = stagingStorageService.stage(file.getInputStream(), originalName);
        } catch (IOException e) {
            throw new StagingException("Upload failed: could not read uploaded content for '" + originalName + "'", e);
        }

        final SignedVideo record = SignedVideo.builder()
                                              .originalName(originalName)
                                              .contentHash(staged.contentHash())
                                              .deviceInfo(deviceInfoNormalizer.normalize(deviceInfo))
                                              .status(SigningStatus.PROCESSING)
                                              .build();
        final Long jobId;
        try {
            jobId = txTemplate.execute(status -> {
                final Long id = jobRecordStore.create(record);
                scheduleAfterCommit(new SigningTask(id, staged.path(), originalName, staged.contentHash()));
                return id;
            });
        } catch (RuntimeException e) {
            log.warn("Job record for '{}' was not committed. Removing staged input.", originalName);
            stagingStorageService.discard(staged.path());
            throw e;
        }
        return new SubmissionResponse(jobId, SigningStatus.PROCESSING, staged.contentHash());
    }

    private void scheduleAfterCommit(final SigningTask task) {
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                dispatch(task);
            }
        });
    }

    private void dispatch(final SigningTask task) {
        try {
            signingTaskExecutor.execute(() -> signingJobWorker.process(task));
            log.info("[{}] Queued for background signing.", task.contextInfo());
        } catch (TaskRejectedException e) {
            log.error("[{}] Signing worker pool rejected the job.", task.contextInfo(), e);
            jobRecordStore.markFailed(task.jobId(), "Signing was rejected by the worker pool: too many jobs in flight");
            stagingStorageService.discard(task.stagedInput());
        }
    }
}
