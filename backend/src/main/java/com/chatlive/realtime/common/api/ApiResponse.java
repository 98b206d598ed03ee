package com.chatlive.realtime.common.api;

import com.chatlive.realtime.common.error.ErrorCode;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * HTTP envelope. On failure {@code error} is the reason and {@code code} the {@link ErrorCode} wire value,
 * the same pair a WebSocket {@code error} frame carries.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean ok, T data, String error, String code) {
    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null, null);
    }

    public static <T> ApiResponse<T> error(ErrorCode code, String reason) {
        return new ApiResponse<>(false, null, reason == null ? code.wire() : reason, code.wire());
    }
}
