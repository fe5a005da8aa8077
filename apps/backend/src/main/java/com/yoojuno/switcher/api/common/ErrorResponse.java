package com.yoojuno.switcher.api.common;

import java.time.Instant;

public record ErrorResponse(String error, long timestampEpochMs) {
    public static ErrorResponse of(String message) {
        return new ErrorResponse(message, Instant.now().toEpochMilli());
    }
}
