package com.eyelevel.videosigning.exception;

import java.io.Serial;

/**
 * A base exception for errors raised while accepting, signing or serving a video.
 */
public class VideoSigningException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 6127450781902349184L;

    public VideoSigningException(String message) {
        super(message);
    }

    public VideoSigningException(String message, Throwable cause) {
        super(message, cause);
    }
}
