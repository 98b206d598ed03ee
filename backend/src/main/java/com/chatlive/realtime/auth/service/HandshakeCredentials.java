package com.chatlive.realtime.auth.service;

import com.chatlive.realtime.auth.service.jwt.JwtService;
import org.springframework.http.HttpHeaders;

import java.util.Optional;

public final class HandshakeCredentials {

    /**
     * Browsers cannot set headers on a WebSocket upgrade, so they may offer the credential
     * as a {@code auth.<token>} subprotocol next to {@link #SUBPROTOCOL}.
     */
    public static final String SUBPROTOCOL = "realtime";
    private static final String SUBPROTOCOL_PREFIX = "auth.";

    private HandshakeCredentials() {
    }

    public static Optional<String> extract(HttpHeaders headers) {
        if (headers == null) return Optional.empty();
        var bearer = JwtService.extractBearerToken(headers.getFirst(HttpHeaders.AUTHORIZATION));
        if (bearer.isPresent()) return bearer;

        var protocols = headers.get("Sec-WebSocket-Protocol");
        if (protocols == null) return Optional.empty();
        for (var line : protocols) {
            if (line == null) continue;
            for (var p : line.split(",")) {
                var t = p.trim();
                if (t.startsWith(SUBPROTOCOL_PREFIX) && t.length() > SUBPROTOCOL_PREFIX.length()) {
                    return Optional.of(t.substring(SUBPROTOCOL_PREFIX.length()));
                }
            }
        }
        return Optional.empty();
    }
}
