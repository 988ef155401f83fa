package com.eyelevel.videosigning.exception.json;

import com.eyelevel.videosigning.exception.VideoSigningException;

import java.io.Serial;

/**
 * Raised when client-supplied JSON, such as upload device metadata, cannot be read or written.
 */
public class JsonParsingException extends VideoSigningException {
    @Serial
    private static final long serialVersionUID = 2958731640127753082L;

    public JsonParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
