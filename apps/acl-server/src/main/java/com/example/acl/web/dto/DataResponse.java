package com.example.acl.web.dto;

/**
 * Success envelope: every data endpoint answers {@code {"data": ...}}.
 */
public record DataResponse<T>(T data) {

    public static <T> DataResponse<T> of(T data) {
        return new DataResponse<>(data);
    }
}
