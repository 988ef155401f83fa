package com.eyelevel.videosigning.repository;

import com.eyelevel.videosigning.model.SignedVideo;
import com.eyelevel.videosigning.model.SigningStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Spring Data JPA repository for the {@link SignedVideo} entity.
 */
@Repository
public interface SignedVideoRepository extends JpaRepository<SignedVideo, Long> {

    /**
     * Finds jobs in a given status created before a threshold. Used by the
     * {@link com.eyelevel.videosigning.scheduler.StaleJobRecoveryScheduler} to find orphaned jobs.
     */
    List<SignedVideo> findByStatusAndCreatedAtBefore(SigningStatus status, LocalDateTime threshold);

    /**
     * Moves a job from {@code expected} to {@code completed}, setting the output name and completion time
     * in the same statement.
     *
     * @return The number of rows updated; 0 if the job is unknown or no longer in {@code expected}.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE SignedVideo v SET v.status = :completed, "
            + "v.outputName = :outputName, v.completedAt = :completedAt, v.errorDetail = null "
            + "WHERE v.id = :id AND v.status = :expected")
    int markCompleted(@Param("id") Long id,
                      @Param("expected") SigningStatus expected,
                      @Param("completed") SigningStatus completed,
                      @Param("outputName") String outputName,
                      @Param("completedAt") LocalDateTime completedAt);

    /**
     * Moves a job from {@code expected} to {@code failed}, setting the error detail and completion time
     * in the same statement.
     *
     * @return The number of rows updated; 0 if the job is unknown or no longer in {@code expected}.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE SignedVideo v SET v.status = :failed, "
            + "v.errorDetail = :errorDetail, v.completedAt = :completedAt, v.outputName = null "
            + "WHERE v.id = :id AND v.status = :expected")
    int markFailed(@Param("id") Long id,
                   @Param("expected") SigningStatus expected,
                   @Param("failed") SigningStatus failed,
                   @Param("errorDetail") String errorDetail,
                   @Param("completedAt") LocalDateTime completedAt);
}
