package com.eyelevel.videosigning.scheduler;

import com.eyelevel.videosigning.config.VideoSigningConfig;
import com.eyelevel.videosigning.model.SignedVideo;
import com.eyelevel.videosigning.service.job.JobRecordStore;
import com.eyelevel.videosigning.service.storage.StagingStorageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * A scheduler that fails jobs left in PROCESSING far longer than any signing run could take,
 * for example after the service was restarted while a job was in flight, and removes the staged
 * uploads those jobs left behind.
 * <p>
 * A job may wait behind a full queue before its own signing run starts, so the effective threshold
 * is never shorter than {@code timeout * (ceil(queueCapacity / poolSize) + 1)}.
 */
@Slf4j
@Component
public class StaleJobRecoveryScheduler {

    private final JobRecordStore jobRecordStore;
    private final StagingStorageService stagingStorageService;
    private final Duration staleThreshold;

    public StaleJobRecoveryScheduler(final JobRecordStore jobRecordStore,
                                     final StagingStorageService stagingStorageService,
                                     final VideoSigningConfig config,
                                     @Value("${app.scheduler.stale-processing-minutes:240}") final long staleMinutes) {
        this.jobRecordStore = jobRecordStore;
        this.stagingStorageService = stagingStorageService;
        this.staleThreshold = effectiveThreshold(Duration.ofMinutes(staleMinutes), config);
    }

    /**
     * @return The longer of the configured threshold and the longest time a healthy job can spend
     *         queued and signing.
     */
    static Duration effectiveThreshold(final Duration configured, final VideoSigningConfig config) {
        final VideoSigningConfig.Worker worker = config.getWorker();
        final int poolSize = Math.max(1, worker.getPoolSize());
        final long queuedRounds = (Math.max(0, worker.getQueueCapacity()) + poolSize - 1L) / poolSize;
        final Duration worstCase = config.getTimeout().multipliedBy(queuedRounds + 1);
        if (configured.compareTo(worstCase) < 0) {
            log.warn("Stale job threshold of {} minutes is shorter than the worst-case queue and signing time of {} "
                     + "minutes. Using {} minutes.", configured.toMinutes(), worstCase.toMinutes(),
                     worstCase.toMinutes());
            return worstCase;
        }
        return configured;
    }

    Duration getStaleThreshold() {
        return staleThreshold;
    }

    /**
     * Jobs still PROCESSING at startup have lost their worker; recover them without waiting for the first tick.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void recoverOnStartup() {
        failStaleJobs();
    }

    /**
     * Marks stale PROCESSING jobs as FAILED and deletes staged uploads older than the threshold. Uses the
     * same guarded transition as the workers, so a job that finishes concurrently keeps its own outcome.
     *
     * @return The number of jobs moved to FAILED.
     */
    @Scheduled(cron = "${app.scheduler.stale-job-recovery:0 */10 * * * *}")
    public int failStaleJobs() {
        final LocalDateTime threshold = LocalDateTime.now().minus(staleThreshold);
        log.info("Running stale job recovery. Finding PROCESSING jobs created before {}.", threshold);

        int failed = 0;
        final List<SignedVideo> staleJobs = jobRecordStore.findProcessingCreatedBefore(threshold);
        if (CollectionUtils.isEmpty(staleJobs)) {
            log.info("No stale jobs found.");
        } else {
            log.warn("Found {} stale jobs to mark as FAILED.", staleJobs.size());
            final String errorDetail = String.format(
                    "Signing did not finish within %d minutes; the job was abandoned.", staleThreshold.toMinutes());
            for (final SignedVideo job : staleJobs) {
                if (jobRecordStore.markFailed(job.getId(), errorDetail)) {
                    failed++;
                }
            }
            log.info("Finished stale job recovery. Marked {} jobs as FAILED.", failed);
        }

        stagingStorageService.purgeStagedOlderThan(staleThreshold);
        return failed;
    }
}
