package com.chatlive.realtime.auth.service;

import com.chatlive.realtime.common.error.ErrorCode;
import com.chatlive.realtime.common.error.RealtimeException;

public class AuthException extends RealtimeException {

    public AuthException(ErrorCode code) {
        super(code, code.wire());
    }

    public AuthException(ErrorCode code, Throwable cause) {
        super(code, code.wire(), cause);
    }

    public static AuthException required() {
        return new AuthException(ErrorCode.AUTH_REQUIRED);
    }

    public static AuthException invalid() {
        return new AuthException(ErrorCode.AUTH_INVALID);
    }

    public static AuthException expired() {
        return new AuthException(ErrorCode.AUTH_EXPIRED);
    }
}
