package com.chatlive.realtime.common.error;

/**
 * Domain failure with a stable error code. {@code getMessage()} is the client-facing
 * reason (e.g. {@code room_not_found}); internals never go into it.
 */
public class RealtimeException extends RuntimeException {

    private final ErrorCode code;

    public RealtimeException(ErrorCode code, String reason) {
        super(reason == null || reason.isBlank() ? code.wire() : reason);
        this.code = code;
    }

    public RealtimeException(ErrorCode code, String reason, Throwable cause) {
        super(reason == null || reason.isBlank() ? code.wire() : reason, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }

    public static RealtimeException accessDenied(String reason) {
        return new RealtimeException(ErrorCode.ACCESS_DENIED, reason);
    }

    public static RealtimeException validation(String reason) {
        return new RealtimeException(ErrorCode.VALIDATION_FAILED, reason);
    }

    public static RealtimeException notFound(String reason) {
        return new RealtimeException(ErrorCode.NOT_FOUND, reason);
    }

    public static RealtimeException permissionDenied(String permission) {
        return new RealtimeException(ErrorCode.PERMISSION_DENIED, "permission_denied:" + permission);
    }
}
