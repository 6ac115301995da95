package com.causalgraph.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    INVALID_WINDOW("INVALID_WINDOW", 400),
    NOT_FOUND("NOT_FOUND", 404),
    DUPLICATE_ID("DUPLICATE_ID", 409),
    ANALYTICS_IN_PROGRESS("ANALYTICS_IN_PROGRESS", 409),
    UNKNOWN_ENTITY("UNKNOWN_ENTITY", 422),
    INSUFFICIENT_DATA("INSUFFICIENT_DATA", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500);

    private final String code;
    private final int httpStatus;
}
