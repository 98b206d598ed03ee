package com.chatlive.realtime.auth.service.jwt;

import java.util.List;

/**
 * {@code permissions} is null when the token carries no claim (role defaults apply).
 */
public record JwtClaims(String userId, String role, List<String> permissions) {
}
