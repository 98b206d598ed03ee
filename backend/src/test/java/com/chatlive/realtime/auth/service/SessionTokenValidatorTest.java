package com.chatlive.realtime.auth.service;

import com.chatlive.realtime.auth.repo.UserAccountRepository;
import com.chatlive.realtime.auth.repo.UserSessionRepository;
import com.chatlive.realtime.common.error.ErrorCode;
import com.chatlive.realtime.testing.MutableClock;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionTokenValidatorTest {

    private final MutableClock clock = MutableClock.startingAt("2026-05-01T12:00:00Z");
    private final UserSessionRepository sessions = mock(UserSessionRepository.class);
    private final UserAccountRepository users = mock(UserAccountRepository.class);
    private final SessionTokenValidator validator = new SessionTokenValidator(sessions, users, clock);

    @Test
    void live_session_resolves_user_permissions() {
        var hash = SessionTokenValidator.hash("raw-handle");
        when(sessions.findByTokenHash(hash)).thenReturn(Optional.of(
                new UserSessionRepository.SessionRow("ses_1", "u_1", clock.instant().plusSeconds(60))));
        when(users.findById("u_1")).thenReturn(Optional.of(
                new UserAccountRepository.UserRow("u_1", "a@example.com", "A", "user", "send_message,view_admin_panel", null, Instant.EPOCH)));

        var identity = validator.validate("raw-handle");

        assertThat(identity.id()).isEqualTo("u_1");
        assertThat(identity.has(Permission.VIEW_ADMIN_PANEL)).isTrue();
        assertThat(identity.has(Permission.SEND_NOTIFICATION)).isFalse();
    }

    @Test
    void expired_session_is_rejected() {
        when(sessions.findByTokenHash(anyString())).thenReturn(Optional.of(
                new UserSessionRepository.SessionRow("ses_2", "u_2", clock.instant())));

        assertThatThrownBy(() -> validator.validate("old"))
                .extracting(ex -> ((AuthException) ex).code())
                .isEqualTo(ErrorCode.AUTH_EXPIRED);
    }

    @Test
    void unknown_handle_or_deleted_user_is_invalid() {
        when(sessions.findByTokenHash(anyString())).thenReturn(Optional.empty());
        assertThatThrownBy(() -> validator.validate("nope"))
                .extracting(ex -> ((AuthException) ex).code())
                .isEqualTo(ErrorCode.AUTH_INVALID);

        when(sessions.findByTokenHash(anyString())).thenReturn(Optional.of(
                new UserSessionRepository.SessionRow("ses_3", "gone", clock.instant().plusSeconds(60))));
        when(users.findById("gone")).thenReturn(Optional.empty());
        assertThatThrownBy(() -> validator.validate("orphan"))
                .extracting(ex -> ((AuthException) ex).code())
                .isEqualTo(ErrorCode.AUTH_INVALID);
    }

    @Test
    void open_session_stores_only_the_hash() {
        var raw = validator.openSession("u_4", Duration.ofHours(1));

        verify(sessions).insert(anyString(), eq(SessionTokenValidator.hash(raw)), eq("u_4"), eq(clock.instant().plus(Duration.ofHours(1))));
        assertThat(raw).isNotBlank();
    }

    @Test
    void handshake_credentials_from_header_or_subprotocol() {
        var bearer = new HttpHeaders();
        bearer.set(HttpHeaders.AUTHORIZATION, "Bearer abc");
        var proto = new HttpHeaders();
        proto.add("Sec-WebSocket-Protocol", "realtime, auth.xyz");

        assertThat(HandshakeCredentials.extract(bearer)).contains("abc");
        assertThat(HandshakeCredentials.extract(proto)).contains("xyz");
        assertThat(HandshakeCredentials.extract(new HttpHeaders())).isEmpty();
    }
}
