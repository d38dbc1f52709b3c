package com.retail.backoffice.dto;

public record ApiError(boolean success, String message, String path) {

    public static ApiError of(String message, String path) {
        return new ApiError(false, message, path);
    }
}
