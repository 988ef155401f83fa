package com.eyelevel.videosigning.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * A single submitted video and the outcome of its signing job.
 * <p>
 * {@code outputName} is set only when the job is {@link SigningStatus#COMPLETED} and
 * {@code errorDetail} only when it is {@link SigningStatus#FAILED}. Both are written together
 * with {@code status} and {@code completedAt} by a single conditional update in
 * {@link com.eyelevel.videosigning.repository.SignedVideoRepository}.
 */
@Entity
@Table(name = "signed_video", indexes = {
        @Index(name = "idx_signed_video_content_hash", columnList = "contentHash"),
        @Index(name = "idx_signed_video_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignedVideo {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private String originalName;

    /**
     * Hex SHA-256 of the uploaded bytes, computed once at acceptance.
     */
    @Column(nullable = false, updatable = false, length = 64)
    private String contentHash;

    @Column
    private String outputName;

    /**
     * Normalized JSON metadata supplied by the client device, or null if absent or malformed.
     */
    @Column(columnDefinition = "TEXT")
    private String deviceInfo;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SigningStatus status;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column
    private LocalDateTime completedAt;

    @Column(columnDefinition = "TEXT")
    private String errorDetail;
}
