package com.flow.sync.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;

import java.time.Instant;

/**
 * Envelope of every REST response: {@code data} on success, {@code error} otherwise.
 *
 * @param <T> the type of the response data
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private final boolean success;
    private final T data;
    private final ErrorInfo error;
    private final Instant timestamp = Instant.now();

    private ApiResponse(boolean success, T data, ErrorInfo error) {
        this.success = success;
        this.data = data;
        this.error = error;
    }

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static <T> ApiResponse<T> error(String message, String code) {
        return error(message, code, null);
    }

    /**
     * Creates an error response with details, either a message or a
     * structured map naming the offending entity.
     */
    public static <T> ApiResponse<T> error(String message, String code, Object details) {
        return new ApiResponse<>(false, null, new ErrorInfo(message, code, details));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorInfo(String message, String code, Object details) {
    }
}
