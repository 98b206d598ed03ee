package com.chatlive.realtime.auth.service;

import com.chatlive.realtime.auth.service.jwt.JwtService;
import com.chatlive.realtime.common.error.ErrorCode;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtTokenValidatorTest {

    private final JwtService jwtService = new JwtService("test-secret-test-secret-test-secret-0123");
    private final JwtTokenValidator validator = new JwtTokenValidator(jwtService);

    @Test
    void valid_token_yields_identity_with_role_defaults() {
        var token = jwtService.issueAccessToken("u_100", "moderator", Duration.ofMinutes(5));

        var identity = validator.validate(token);

        assertThat(identity.id()).isEqualTo("u_100");
        assertThat(identity.role()).isEqualTo(Role.MODERATOR);
        assertThat(identity.has(Permission.MODERATE_CHAT)).isTrue();
        assertThat(identity.has(Permission.VIEW_ADMIN_PANEL)).isFalse();
    }

    @Test
    void explicit_permission_claim_overrides_role() {
        var token = jwtService.issueAccessToken("u_101", "guest", List.of("send_message"), Duration.ofMinutes(5));

        var identity = validator.validate(token);

        assertThat(identity.has(Permission.SEND_MESSAGE)).isTrue();
        assertThat(identity.has(Permission.RECEIVE_NOTIFICATIONS)).isTrue();
        assertThat(identity.has(Permission.SEND_NOTIFICATION)).isFalse();
    }

    @Test
    void missing_credential_is_auth_required() {
        assertThatThrownBy(() -> validator.validate(" "))
                .isInstanceOf(AuthException.class)
                .extracting(ex -> ((AuthException) ex).code())
                .isEqualTo(ErrorCode.AUTH_REQUIRED);
    }

    @Test
    void expired_token_is_auth_expired() {
        var token = jwtService.issueAccessToken("u_102", "user", Duration.ofMinutes(-1));

        assertThatThrownBy(() -> validator.validate(token))
                .extracting(ex -> ((AuthException) ex).code())
                .isEqualTo(ErrorCode.AUTH_EXPIRED);
    }

    @Test
    void token_signed_with_other_key_is_invalid() {
        var foreign = new JwtService("another-secret-another-secret-another-1").issueAccessToken("u_103", "admin", Duration.ofMinutes(5));

        assertThatThrownBy(() -> validator.validate(foreign))
                .extracting(ex -> ((AuthException) ex).code())
                .isEqualTo(ErrorCode.AUTH_INVALID);
    }

    @Test
    void garbage_and_unknown_role_are_invalid() {
        var unknownRole = jwtService.issueAccessToken("u_104", "superuser", Duration.ofMinutes(5));

        assertThatThrownBy(() -> validator.validate("not.a.jwt"))
                .extracting(ex -> ((AuthException) ex).code())
                .isEqualTo(ErrorCode.AUTH_INVALID);
        assertThatThrownBy(() -> validator.validate(unknownRole))
                .extracting(ex -> ((AuthException) ex).code())
                .isEqualTo(ErrorCode.AUTH_INVALID);
    }
}
