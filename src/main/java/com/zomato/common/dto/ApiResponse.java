package com.zomato.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope for every successful API response.
 *
 * <p>{@code message} is omitted from the JSON when null.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, T data, String message) {

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static <T> ApiResponse<T> ok(T data, String message) {
        return new ApiResponse<>(true, data, message);
    }
}
