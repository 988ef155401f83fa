package com.eyelevel.videosigning.exception;

import lombok.Getter;

import java.io.Serial;
import java.util.Set;

/**
 * Thrown when a submitted file's extension is not in the accepted set. No job record is created.
 */
@Getter
public class UnsupportedVideoFormatException extends VideoSigningException {
    @Serial
    private static final long serialVersionUID = -2381736620945180447L;

    private final transient Set<String> supportedFormats;

    public UnsupportedVideoFormatException(String fileName, Set<String> supportedFormats) {
        super(String.format("Unsupported file format for '%s'. Supported: %s", fileName, supportedFormats));
        this.supportedFormats = supportedFormats;
    }
}
