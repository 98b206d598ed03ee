package com.chatlive.realtime.auth.service.jwt;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Optional;

@Service
public class JwtService {

    private final SecretKey key;

    public JwtService(@Value("${app.jwt.secret:dev-secret-change-me-please-32bytes-min}") String secret) {
        var bytes = secret.getBytes(StandardCharsets.UTF_8);
        this.key = Keys.hmacShaKeyFor(bytes);
    }

    public String issueAccessToken(String userId, String role, Duration ttl) {
        return issueAccessToken(userId, role, null, ttl);
    }

    /**
     * @param permissions explicit capability names, {@code List.of("all")} for everything,
     *                    or null to let the role decide
     */
    public String issueAccessToken(String userId, String role, Collection<String> permissions, Duration ttl) {
        var now = Instant.now();
        var builder = Jwts.builder()
                .setSubject(userId)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plus(ttl)))
                .claim("role", role);
        if (permissions != null) {
            builder = builder.claim("permissions", new ArrayList<>(permissions));
        }
        return builder
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    public JwtClaims parse(String token) {
        Claims claims = Jwts.parserBuilder()
                .setSigningKey(key)
                .build()
                .parseClaimsJws(token)
                .getBody();

        var role = claims.get("role") == null ? null : String.valueOf(claims.get("role"));
        return new JwtClaims(claims.getSubject(), role, permissionsClaim(claims.get("permissions")));
    }

    private static List<String> permissionsClaim(Object raw) {
        if (raw == null) return null;
        if (raw instanceof Collection<?> c) {
            var out = new ArrayList<String>(c.size());
            for (var o : c) {
                if (o != null) out.add(String.valueOf(o));
            }
            return out;
        }
        // "all" or a comma separated string
        return List.of(String.valueOf(raw).split(","));
    }

    public static Optional<String> extractBearerToken(String authorization) {
        if (authorization == null || authorization.isBlank()) return Optional.empty();
        var prefix = "Bearer ";
        if (!authorization.startsWith(prefix)) return Optional.empty();
        var token = authorization.substring(prefix.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
