package com.chatlive.realtime.ratelimit;

import com.chatlive.realtime.common.error.ErrorCode;
import com.chatlive.realtime.common.error.RealtimeException;

public class RateLimitExceededException extends RealtimeException {

    private final RateLimitResult result;

    public RateLimitExceededException(RateLimitResult result) {
        super(ErrorCode.RATE_LIMIT_EXCEEDED, ErrorCode.RATE_LIMIT_EXCEEDED.wire());
        this.result = result;
    }

    public RateLimitResult result() {
        return result;
    }
}
