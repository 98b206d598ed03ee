package com.chatlive.realtime.ws;

import com.chatlive.realtime.common.error.ErrorCode;

/**
 * Body of the {@code error} event: {@code message} is the specific reason, {@code code} the error class.
 */
public record ErrorPayload(String message, String code) {

    public static ErrorPayload of(ErrorCode code, String reason) {
        return new ErrorPayload(reason == null ? code.wire() : reason, code.wire());
    }
}
