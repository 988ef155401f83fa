package com.eyelevel.videosigning.exception.apiclient;

import com.eyelevel.videosigning.exception.VideoSigningException;
import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.io.Serial;

/**
 * A video signing failure that the API reports with a fixed HTTP status.
 */
@Getter
public class ApiException extends VideoSigningException {

    @Serial
    private static final long serialVersionUID = 7714620391825031468L;
    private final HttpStatus status;

    public ApiException(String message, HttpStatus status) {
        super(message);
        this.status = status;
    }
}
