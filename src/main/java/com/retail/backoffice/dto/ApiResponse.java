package com.retail.backoffice.dto;

import java.util.Map;

/**
 * Envelope for every successful API response.
 */
public record ApiResponse<T>(boolean success, String message, T data, Map<String, Object> metadata) {

    public static <T> ApiResponse<T> of(String message, T data, Map<String, Object> metadata) {
        return new ApiResponse<>(true, message, data, metadata);
    }
}
