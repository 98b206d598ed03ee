package com.chatlive.realtime.common.error;

public enum ErrorCode {
    AUTH_REQUIRED("auth_required", 401, true),
    AUTH_INVALID("invalid_token", 401, true),
    AUTH_EXPIRED("token_expired", 401, true),
    PERMISSION_DENIED("permission_denied", 403, true),
    ACCESS_DENIED("access_denied", 403, false),
    VALIDATION_FAILED("validation_failed", 400, false),
    RATE_LIMIT_EXCEEDED("rate_limit_exceeded", 429, false),
    NOT_FOUND("not_found", 404, false),
    INTERNAL("internal_error", 500, false);

    private final String wire;
    private final int httpStatus;
    private final boolean critical;

    ErrorCode(String wire, int httpStatus, boolean critical) {
        this.wire = wire;
        this.httpStatus = httpStatus;
        this.critical = critical;
    }

    public String wire() {
        return wire;
    }

    public int httpStatus() {
        return httpStatus;
    }

    /**
     * Critical errors end the WebSocket connection they occur on.
     */
    public boolean isCritical() {
        return critical;
    }
}
