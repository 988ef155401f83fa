package com.eyelevel.videosigning.exception.handler;

import com.eyelevel.videosigning.dto.common.ApiResponse;
import com.eyelevel.videosigning.exception.ArtifactNotReadyException;
import com.eyelevel.videosigning.exception.StagingException;
import com.eyelevel.videosigning.exception.UnsupportedVideoFormatException;
import com.eyelevel.videosigning.exception.apiclient.ApiException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.stream.Collectors;

/**
 * A centralized exception handler for the entire application.
 * It intercepts exceptions thrown from controllers and converts them into the
 * standardized ApiResponse format with the semantically correct HTTP status code.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // --- 4xx Client Error Handlers ---

    /**
     * Rejected formats and premature artifact requests. (400 Bad Request)
     */
    @ExceptionHandler({UnsupportedVideoFormatException.class, ArtifactNotReadyException.class})
    public ResponseEntity<ApiResponse<Object>> handleBadRequest(RuntimeException ex) {
        log.warn("Bad Request Exception: {}", ex.getMessage());
        return build(ApiResponse.error(ex.getMessage()), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles missing multipart parts such as the 'file' field. (400 Bad Request)
     */
    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ApiResponse<Object>> handleMissingPart(MissingServletRequestPartException ex) {
        String errorMessage = String.format("Required part '%s' is missing.", ex.getRequestPartName());
        log.warn("Handling MissingServletRequestPartException: {}", errorMessage);
        return build(ApiResponse.error("Required file is missing.", errorMessage), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiResponse<Object>> handleMissingServletRequestParameter(MissingServletRequestParameterException ex) {
        String errorMessage = String.format("Required parameter '%s' of type '%s' is missing.", ex.getParameterName(), ex.getParameterType());
        log.warn("Handling MissingServletRequestParameterException: {}", errorMessage);
        return build(ApiResponse.error("Required parameter is missing.", errorMessage), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles validation errors from @Validated on path variables and request parameters. (400 Bad Request)
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Object>> handleConstraintViolation(ConstraintViolationException ex) {
        String errors = ex.getConstraintViolations().stream()
                .map(violation -> {
                    String path = violation.getPropertyPath().toString();
                    return String.format("'%s': %s", path.substring(path.lastIndexOf('.') + 1), violation.getMessage());
                })
                .collect(Collectors.joining(", "));
        log.warn("Handling constraint violation exception: {}", errors);
        return build(ApiResponse.error("Invalid input provided.", "Validation failed: " + errors), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ApiResponse<Object>> handleHandlerMethodValidation(HandlerMethodValidationException ex) {
        String errors = ex.getAllErrors().stream()
                .map(error -> String.valueOf(error.getDefaultMessage()))
                .collect(Collectors.joining(", "));
        log.warn("Handling method validation exception: {}", errors);
        return build(ApiResponse.error("Invalid input provided.", "Validation failed: " + errors), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles type mismatch errors for path variables (e.g., a string for a Long job ID). (400 Bad Request)
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String errorMessage = String.format("Invalid value '%s' for parameter '%s'. Expected type '%s'.", ex.getValue(),
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName()
                        : String.valueOf(ex.getRequiredType()));
        log.warn("Handling type mismatch exception: {}", errorMessage);
        return build(ApiResponse.error("Invalid parameter type provided.", errorMessage), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles exceptions that carry their own status, such as unknown jobs and missing signed files (404).
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiResponse<Object>> handleApiException(ApiException ex) {
        log.warn("{} ({}): {}", ex.getClass().getSimpleName(), ex.getStatus().value(), ex.getMessage());
        return build(ApiResponse.error(ex.getMessage()), ex.getStatus());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiResponse<Object>> handleMaxUploadSize(MaxUploadSizeExceededException ex) {
        log.warn("Upload rejected: {}", ex.getMessage());
        return build(ApiResponse.error("Uploaded file is too large."), HttpStatus.PAYLOAD_TOO_LARGE);
    }

    // --- 5xx Server Error Handlers ---

    /**
     * Handles uploads that could not be written to the staging directory. (500 Internal Server Error)
     */
    @ExceptionHandler(StagingException.class)
    public ResponseEntity<ApiResponse<Object>> handleStaging(StagingException ex) {
        log.error("Staging Exception: {}", ex.getMessage(), ex);
        return build(ApiResponse.error(ex.getMessage()), HttpStatus.INTERNAL_SERVER_ERROR);
    }

    /**
     * A final catch-all handler for any other unexpected exceptions. (500 Internal Server Error)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> handleGenericException(Exception ex) {
        log.error("An unexpected internal server error occurred", ex);
        return build(ApiResponse.error("An unexpected internal error occurred. Please contact support.",
                ex.getClass().getSimpleName()), HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private static ResponseEntity<ApiResponse<Object>> build(ApiResponse<Object> body, HttpStatus status) {
        return new ResponseEntity<>(body.toBuilder().statusCode(status.value()).build(), status);
    }
}
