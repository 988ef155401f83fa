package com.eyelevel.videosigning.dto.job;

import org.springframework.core.io.Resource;

/**
 * A signed video ready to be streamed to the client.
 *
 * @param fileName      The generated output name, used as the download filename.
 * @param resource      The artifact's bytes.
 * @param contentType   The media type of the artifact.
 * @param contentLength The artifact's size in bytes.
 */
public record SignedArtifact(String fileName, Resource resource, String contentType, long contentLength) {
}
