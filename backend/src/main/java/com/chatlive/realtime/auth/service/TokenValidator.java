package com.chatlive.realtime.auth.service;

/**
 * Turns a presented credential into an {@link Identity}. Implementations never return
 * null: an absent, malformed, unknown or expired credential raises {@link AuthException}.
 */
public interface TokenValidator {

    Identity validate(String credential);
}
