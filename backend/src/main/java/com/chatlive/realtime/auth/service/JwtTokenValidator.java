package com.chatlive.realtime.auth.service;

import com.chatlive.realtime.auth.service.jwt.JwtClaims;
import com.chatlive.realtime.auth.service.jwt.JwtService;
import com.chatlive.realtime.common.error.ErrorCode;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(prefix = "app.auth", name = "strategy", havingValue = "jwt", matchIfMissing = true)
public class JwtTokenValidator implements TokenValidator {

    private final JwtService jwtService;

    public JwtTokenValidator(JwtService jwtService) {
        this.jwtService = jwtService;
    }

    @Override
    public Identity validate(String credential) {
        if (credential == null || credential.isBlank()) {
            throw AuthException.required();
        }

        final JwtClaims claims;
        try {
            claims = jwtService.parse(credential.trim());
        } catch (ExpiredJwtException ex) {
            throw AuthException.expired();
        } catch (JwtException | IllegalArgumentException ex) {
            throw new AuthException(ErrorCode.AUTH_INVALID, ex);
        }

        if (claims.userId() == null || claims.userId().isBlank()) {
            throw AuthException.invalid();
        }
        var role = Role.parse(claims.role()).orElseThrow(AuthException::invalid);
        return new Identity(claims.userId(), role, PermissionSet.parse(claims.permissions(), role));
    }
}
