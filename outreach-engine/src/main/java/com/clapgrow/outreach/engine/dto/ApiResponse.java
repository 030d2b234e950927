package com.clapgrow.outreach.engine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Response envelope for the campaign API.
 *
 * <pre>
 * {@code
 * return ResponseEntity.ok(ApiResponse.success(campaign));
 * return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.error("No active run"));
 * }
 * </pre>
 *
 * @param <T> Type of the data payload
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
    boolean success,
    T data,
    String error
) {
    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static ApiResponse<Void> successEmpty() {
        return new ApiResponse<>(true, null, null);
    }

    public static <T> ApiResponse<T> error(String error) {
        return new ApiResponse<>(false, null, error);
    }
}
