package com.eyelevel.videosigning.exception;

import com.eyelevel.videosigning.exception.apiclient.NotFoundException;

import java.io.Serial;

/**
 * Thrown when a job is completed but its signed output no longer exists in the artifact directory.
 */
public class ArtifactMissingException extends NotFoundException {
    @Serial
    private static final long serialVersionUID = -1180468305473298662L;

    public ArtifactMissingException(String message) {
        super(message);
    }
}
