package com.chatlive.realtime.presence;

import com.chatlive.realtime.auth.repo.UserAccountRepository;
import com.chatlive.realtime.common.error.RealtimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Presence is derived from {@code app_user.last_seen}: null means a connection is open,
 * otherwise the subject counts as online until the liveness threshold has passed.
 */
@Service
public class PresenceService {

    private static final Logger log = LoggerFactory.getLogger(PresenceService.class);

    private final UserAccountRepository userRepository;
    private final Clock clock;
    private final Duration livenessThreshold;

    public PresenceService(
            UserAccountRepository userRepository,
            Clock clock,
            @Value("${app.presence.liveness-threshold:30s}") Duration livenessThreshold
    ) {
        this.userRepository = userRepository;
        this.clock = clock;
        this.livenessThreshold = livenessThreshold;
    }

    public boolean isOnline(Instant lastSeen, Instant now) {
        if (lastSeen == null) return true;
        return Duration.between(lastSeen, now).compareTo(livenessThreshold) < 0;
    }

    public boolean isOnline(String identityId) {
        return userRepository.findById(identityId)
                .map(u -> isOnline(u.lastSeen(), clock.instant()))
                .orElse(false);
    }

    public PresenceStatus snapshot(String identityId) {
        var user = userRepository.findById(identityId)
                .orElseThrow(() -> RealtimeException.notFound("user_not_found"));
        return new PresenceStatus(user.id(), isOnline(user.lastSeen(), clock.instant()), user.lastSeen());
    }

    public void markConnected(String identityId) {
        userRepository.updateLastSeen(identityId, null);
        log.debug("presence_connected userId={}", identityId);
    }

    /**
     * Call only when the identity's last open connection has gone away.
     */
    public void markDisconnected(String identityId) {
        userRepository.updateLastSeen(identityId, clock.instant());
        log.debug("presence_disconnected userId={}", identityId);
    }

    public void touch(String identityId) {
        userRepository.updateLastSeen(identityId, clock.instant());
    }

    public Duration livenessThreshold() {
        return livenessThreshold;
    }
}
