package com.chatlive.realtime.ws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Probes every open connection and closes the ones idle past the inactivity ceiling. Closing
 * goes through the normal close callback, which unregisters and updates presence.
 */
@Component
public class HeartbeatScheduler {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatScheduler.class);

    private final ConnectionRegistry registry;
    private final WsBroadcaster broadcaster;
    private final Clock clock;
    private final Duration inactivityTimeout;

    public HeartbeatScheduler(ConnectionRegistry registry, WsBroadcaster broadcaster, Clock clock, WsProperties props) {
        this.registry = registry;
        this.broadcaster = broadcaster;
        this.clock = clock;
        this.inactivityTimeout = props.effectiveInactivityTimeout();
    }

    @Scheduled(fixedDelayString = "${app.ws.heartbeat-interval-ms:300000}", initialDelayString = "${app.ws.heartbeat-interval-ms:300000}")
    public void heartbeat() {
        var closed = sweep(clock.instant());
        if (closed > 0) {
            log.info("heartbeat_sweep closed={} open={}", closed, registry.count());
        }
    }

    /**
     * @return number of connections closed for inactivity
     */
    public int sweep(Instant now) {
        var closed = 0;
        for (var conn : registry.all()) {
            var idle = Duration.between(conn.lastActivityAt(), now);
            if (idle.compareTo(inactivityTimeout) >= 0) {
                log.warn("inactivity_timeout connectionId={} userId={} idleSeconds={}", conn.connectionId(), conn.identityId(), idle.toSeconds());
                RealtimeWsHandler.closeQuietly(conn, RealtimeWsHandler.INACTIVITY_TIMEOUT);
                closed++;
            } else {
                broadcaster.sendTo(conn, "ping", Map.of("timestamp", now));
            }
        }
        return closed;
    }
}
