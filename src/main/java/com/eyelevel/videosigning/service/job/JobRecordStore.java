package com.eyelevel.videosigning.service.job;

import com.eyelevel.videosigning.model.SignedVideo;
import com.eyelevel.videosigning.model.SigningStatus;
import com.eyelevel.videosigning.repository.SignedVideoRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * The durable table of signing jobs.
 * <p>
 * Terminal transitions are single conditional updates guarded on {@link SigningStatus#PROCESSING}, so
 * a record moves to a terminal state at most once and readers never see a half-written outcome. They
 * run in their own transaction so the outcome is committed regardless of the caller's transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobRecordStore {

    private final SignedVideoRepository repository;

    /**
     * Persists a new job record.
     *
     * @return The generated job ID.
     */
    @Transactional
    public Long create(final SignedVideo record) {
        if (record.getId() != null) {
            throw new IllegalArgumentException("A new job record must not carry an ID, got " + record.getId());
        }
        final SignedVideo saved = repository.saveAndFlush(record);
        log.info("Created job record ID: {} for '{}' with status {}", saved.getId(), saved.getOriginalName(),
                 saved.getStatus());
        return saved.getId();
    }

    @Transactional(readOnly = true)
    public Optional<SignedVideo> getById(final Long id) {
        return repository.findById(id);
    }

    /**
     * Moves a PROCESSING job to COMPLETED with its output name.
     *
     * @return {@code true} if the transition happened; {@code false} if the job is unknown or already terminal.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markCompleted(final Long id, final String outputName) {
        final int updated = repository.markCompleted(id, SigningStatus.PROCESSING, SigningStatus.COMPLETED,
                                                     outputName, LocalDateTime.now());
        return logTransition(id, SigningStatus.COMPLETED, updated);
    }

    /**
     * Moves a PROCESSING job to FAILED with a human-readable cause.
     *
     * @return {@code true} if the transition happened; {@code false} if the job is unknown or already terminal.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markFailed(final Long id, final String errorDetail) {
        final int updated = repository.markFailed(id, SigningStatus.PROCESSING, SigningStatus.FAILED, errorDetail,
                                                  LocalDateTime.now());
        return logTransition(id, SigningStatus.FAILED, updated);
    }

    @Transactional(readOnly = true)
    public List<SignedVideo> findProcessingCreatedBefore(final LocalDateTime threshold) {
        return repository.findByStatusAndCreatedAtBefore(SigningStatus.PROCESSING, threshold);
    }

    private boolean logTransition(final Long id, final SigningStatus target, final int updated) {
        if (updated == 0) {
            log.warn("Job ID {} was not moved to {}: it does not exist or is no longer PROCESSING.", id, target);
            return false;
        }
        log.info("Job ID {} moved to {}.", id, target);
        return true;
    }
}
