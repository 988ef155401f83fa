package com.eyelevel.videosigning.dto.job;

import com.eyelevel.videosigning.model.SigningStatus;

/**
 * Acknowledgement returned once an upload has been staged and its job record created.
 *
 * @param jobId       The ID to poll for status and to download the signed artifact.
 * @param status      Always {@link SigningStatus#PROCESSING} at acknowledgement time.
 * @param contentHash Hex SHA-256 of the uploaded bytes.
 */
public record SubmissionResponse(Long jobId, SigningStatus status, String contentHash) {
}
