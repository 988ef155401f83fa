package com.eyelevel.videosigning.exception;

import java.io.Serial;

/**
 * Thrown when a signed artifact is requested for a job that has not completed.
 */
public class ArtifactNotReadyException extends VideoSigningException {
    @Serial
    private static final long serialVersionUID = 8843406127925508513L;

    public ArtifactNotReadyException(String message) {
        super(message);
    }
}
