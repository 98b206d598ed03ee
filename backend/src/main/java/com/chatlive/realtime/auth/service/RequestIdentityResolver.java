package com.chatlive.realtime.auth.service;

import com.chatlive.realtime.auth.service.jwt.JwtService;
import org.springframework.stereotype.Component;

@Component
public class RequestIdentityResolver {

    private final TokenValidator tokenValidator;

    public RequestIdentityResolver(TokenValidator tokenValidator) {
        this.tokenValidator = tokenValidator;
    }

    public Identity require(String authorization) {
        var token = JwtService.extractBearerToken(authorization).orElseThrow(AuthException::required);
        return tokenValidator.validate(token);
    }
}
