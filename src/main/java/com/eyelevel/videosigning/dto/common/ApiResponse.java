package com.eyelevel.videosigning.dto.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

/**
 * A standardized, generic wrapper for all JSON API responses.
 * It provides a consistent structure for both successful and failed responses.
 **/
@Getter
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    /**
     * A message to display to the user.
     */
    private final String displayMessage;

    /**
     * The response data.
     */
    private final T response;

    /**
     * A flag indicating whether to show the display message.
     */
    private final Boolean showMessage;

    /**
     * The HTTP status code of the response.
     */
    private final Integer statusCode;

    /**
     * Additional detail about a failure, such as the offending parameter.
     */
    private final String errorDetail;

    public static <T> ApiResponse<T> success(final T response, final String displayMessage, final int statusCode) {
        return ApiResponse.<T>builder()
                          .response(response)
                          .displayMessage(displayMessage)
                          .showMessage(true)
                          .statusCode(statusCode)
                          .build();
    }

    public static <T> ApiResponse<T> error(final String displayMessage) {
        return ApiResponse.<T>builder().displayMessage(displayMessage).showMessage(true).build();
    }

    public static <T> ApiResponse<T> error(final String displayMessage, final String errorDetail) {
        return ApiResponse.<T>builder().displayMessage(displayMessage).errorDetail(errorDetail).showMessage(true)
                          .build();
    }
}
