package com.selfmx.gateway.endpoint.dto;

/**
 * Error envelope: {@code {"error":{"code":"...","message":"..."}}}.
 */
public record ErrorDto(Body error) {

    public static ErrorDto of(String code, String message) {
        return new ErrorDto(new Body(code, message));
    }

    public record Body(String code, String message) {
    }
}
