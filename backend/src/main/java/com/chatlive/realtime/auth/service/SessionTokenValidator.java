package com.chatlive.realtime.auth.service;

import com.chatlive.realtime.auth.repo.UserAccountRepository;
import com.chatlive.realtime.auth.repo.UserSessionRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.UUID;

/**
 * Opaque session handles looked up in {@code user_session}. Only the SHA-256 of a handle is stored.
 */
@Service
@ConditionalOnProperty(prefix = "app.auth", name = "strategy", havingValue = "session")
public class SessionTokenValidator implements TokenValidator {

    private static final SecureRandom RNG = new SecureRandom();

    private final UserSessionRepository sessionRepository;
    private final UserAccountRepository userRepository;
    private final Clock clock;

    public SessionTokenValidator(UserSessionRepository sessionRepository, UserAccountRepository userRepository, Clock clock) {
        this.sessionRepository = sessionRepository;
        this.userRepository = userRepository;
        this.clock = clock;
    }

    @Override
    public Identity validate(String credential) {
        if (credential == null || credential.isBlank()) {
            throw AuthException.required();
        }
        var session = sessionRepository.findByTokenHash(hash(credential.trim()))
                .orElseThrow(AuthException::invalid);
        if (!session.expiresAt().isAfter(clock.instant())) {
            throw AuthException.expired();
        }

        var user = userRepository.findById(session.userId()).orElseThrow(AuthException::invalid);
        var role = Role.parse(user.role()).orElseThrow(AuthException::invalid);
        return new Identity(user.id(), role, PermissionSet.parseCsv(user.permissions(), role));
    }

    /**
     * Creates a session for {@code userId} and returns the raw handle; only its hash is persisted.
     */
    public String openSession(String userId, Duration ttl) {
        var raw = newHandle();
        sessionRepository.insert("ses_" + UUID.randomUUID(), hash(raw), userId, clock.instant().plus(ttl));
        return raw;
    }

    static String hash(String handle) {
        try {
            var digest = MessageDigest.getInstance("SHA-256").digest(handle.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("session_hash_unavailable", e);
        }
    }

    private static String newHandle() {
        var bytes = new byte[32];
        RNG.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
