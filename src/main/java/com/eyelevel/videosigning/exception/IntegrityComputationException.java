package com.eyelevel.videosigning.exception;

import java.io.Serial;

/**
 * Thrown by the background job when the staged input cannot be digested or no longer
 * matches the content hash recorded at acceptance.
 */
public class IntegrityComputationException extends VideoSigningException {
    @Serial
    private static final long serialVersionUID = -5190355830261846710L;

    public IntegrityComputationException(String message) {
        super(message);
    }

    public IntegrityComputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
