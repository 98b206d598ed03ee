package com.chatlive.realtime.chat.service;

import com.chatlive.realtime.chat.api.MessageItem;
import com.chatlive.realtime.ratelimit.RateLimitWarning;

/**
 * {@code inserted} is false when a resend matched an already stored message.
 */
public record SendResult(MessageItem message, boolean inserted, RateLimitWarning warning) {
}
