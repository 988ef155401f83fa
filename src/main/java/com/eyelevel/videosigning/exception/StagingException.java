package com.eyelevel.videosigning.exception;

import java.io.Serial;

/**
 * Thrown when the uploaded bytes could not be written to the staging directory.
 * Surfaced to the submitter immediately; no job record is created.
 */
public class StagingException extends VideoSigningException {
    @Serial
    private static final long serialVersionUID = 2716054399130863015L;

    public StagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
