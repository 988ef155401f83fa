package com.eyelevel.videosigning.exception.apiclient;

import org.springframework.http.HttpStatus;

import java.io.Serial;

/**
 * An unknown job ID or a signed video that is no longer on disk (HTTP 404).
 */
public class NotFoundException extends ApiException {

    @Serial
    private static final long serialVersionUID = -1893320570446125917L;

    public NotFoundException(String message) {
        super(message, HttpStatus.NOT_FOUND);
    }
}
