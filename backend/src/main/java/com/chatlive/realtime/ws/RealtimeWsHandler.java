package com.chatlive.realtime.ws;

import com.chatlive.realtime.auth.service.Identity;
import com.chatlive.realtime.auth.service.HandshakeCredentials;
import com.chatlive.realtime.common.error.ErrorCode;
import com.chatlive.realtime.common.error.RealtimeException;
import com.chatlive.realtime.metrics.RealtimeMetrics;
import com.chatlive.realtime.presence.PresenceService;
import com.chatlive.realtime.ratelimit.RateLimitExceededException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.SubProtocolCapable;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * One instance per namespace. Identity comes from the handshake; every inbound frame is queued
 * on the connection's mailbox and handed to the {@link NamespaceDispatcher} in arrival order.
 */
public class RealtimeWsHandler extends TextWebSocketHandler implements SubProtocolCapable {

    public static final CloseStatus INACTIVITY_TIMEOUT = new CloseStatus(4000, "inactivity_timeout");

    private static final Logger log = LoggerFactory.getLogger(RealtimeWsHandler.class);

    private final NamespaceDispatcher dispatcher;
    private final ConnectionRegistry registry;
    private final WsBroadcaster broadcaster;
    private final PresenceService presenceService;
    private final RealtimeMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final Clock clock;
    private final WsProperties props;

    public RealtimeWsHandler(
            NamespaceDispatcher dispatcher,
            ConnectionRegistry registry,
            WsBroadcaster broadcaster,
            PresenceService presenceService,
            RealtimeMetrics metrics,
            ObjectMapper objectMapper,
            Executor executor,
            Clock clock,
            WsProperties props
    ) {
        this.dispatcher = dispatcher;
        this.registry = registry;
        this.broadcaster = broadcaster;
        this.presenceService = presenceService;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.clock = clock;
        this.props = props;
    }

    public Namespace namespace() {
        return dispatcher.namespace();
    }

    @Override
    public List<String> getSubProtocols() {
        return List.of(HandshakeCredentials.SUBPROTOCOL);
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        var ns = dispatcher.namespace();
        var identity = (Identity) session.getAttributes().get(WsAuthHandshakeInterceptor.ATTR_IDENTITY);
        if (identity == null) {
            // Only reachable if the interceptor was bypassed.
            log.warn("ws_unauthenticated_session sessionId={} namespace={}", session.getId(), ns.wire());
            session.close(CloseStatus.POLICY_VIOLATION.withReason(ErrorCode.AUTH_REQUIRED.wire()));
            return;
        }

        var decorated = new ConcurrentWebSocketSessionDecorator(session, props.effectiveSendTimeLimitMs(), props.effectiveSendBufferSizeLimit());
        var clientIp = (String) session.getAttributes().get(WsAuthHandshakeInterceptor.ATTR_CLIENT_IP);
        var conn = new ConnectionInfo(session.getId(), identity, ns, decorated, clientIp, clock.instant(),
                new ConnectionMailbox(session.getId(), executor, props.effectiveMaxPendingFrames()));

        var required = ns.requiredPermission();
        if (!identity.has(required)) {
            metrics.connectionRejected(ErrorCode.PERMISSION_DENIED.wire());
            log.info("ws_permission_denied connectionId={} userId={} namespace={} permission={}",
                    conn.connectionId(), identity.id(), ns.wire(), required.wire());
            broadcaster.sendTo(conn, "error", ErrorPayload.of(ErrorCode.PERMISSION_DENIED, "permission_denied:" + required.wire()));
            closeQuietly(conn, CloseStatus.POLICY_VIOLATION);
            return;
        }

        registry.register(conn);
        registry.join(Channel.user(identity.id()), conn.connectionId());
        metrics.connectionOpened(ns);
        log.info("ws_connected connectionId={} userId={} namespace={} ip={}", conn.connectionId(), identity.id(), ns.wire(), clientIp);

        // Setup runs on the mailbox so that frames arriving meanwhile queue behind it.
        conn.mailbox().submit(() -> {
            try {
                dispatcher.onConnected(conn);
                if (registry.get(conn.connectionId()).isEmpty()) {
                    log.debug("ws_closed_during_setup connectionId={} userId={}", conn.connectionId(), identity.id());
                    return;
                }
                presenceService.markConnected(identity.id());
                if (registry.get(conn.connectionId()).isEmpty() && registry.connectionsOf(identity.id()).isEmpty()) {
                    // The close path may have written last_seen before markConnected cleared it.
                    presenceService.markDisconnected(identity.id());
                    return;
                }
                conn.transition(ConnectionState.AUTHENTICATED_IDLE);
                var payload = new LinkedHashMap<String, Object>();
                payload.put("userId", identity.id());
                payload.put("status", "online");
                payload.put("namespace", ns.wire());
                broadcaster.sendTo(conn, "connected", payload);
            } catch (Exception ex) {
                log.warn("ws_connect_setup_failed connectionId={} userId={} namespace={}", conn.connectionId(), identity.id(), ns.wire(), ex);
                broadcaster.sendTo(conn, "error", ErrorPayload.of(ErrorCode.INTERNAL, null));
                closeQuietly(conn, CloseStatus.SERVER_ERROR);
            }
        });
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        var conn = registry.get(session.getId()).orElse(null);
        if (conn == null) {
            session.close(CloseStatus.POLICY_VIOLATION.withReason(ErrorCode.AUTH_REQUIRED.wire()));
            return;
        }
        conn.touch(clock.instant());

        var frame = parseFrame(message.getPayload());
        if (frame == null) {
            broadcaster.sendTo(conn, "error", ErrorPayload.of(ErrorCode.VALIDATION_FAILED, "invalid_frame"));
            return;
        }
        if (!conn.mailbox().submit(() -> process(conn, frame))) {
            if (conn.mailbox().isClosed()) {
                log.debug("ws_frame_dropped connectionId={} event={}", conn.connectionId(), frame.event());
                return;
            }
            log.debug("ws_inbound_backlog_full connectionId={} userId={} event={} pending={}",
                    conn.connectionId(), conn.identityId(), frame.event(), conn.mailbox().pending());
            broadcaster.sendTo(conn, "error", ErrorPayload.of(ErrorCode.VALIDATION_FAILED, "too_many_pending_frames"), frame.ackId());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("ws_transport_error sessionId={}", session.getId(), exception);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        var removal = registry.unregister(session.getId()).orElse(null);
        if (removal == null) return;

        var conn = removal.connection();
        conn.transition(ConnectionState.DISCONNECTED);
        conn.mailbox().close();
        log.info("ws_disconnected connectionId={} userId={} namespace={} code={} reason={}",
                conn.connectionId(), conn.identityId(), conn.namespace().wire(), status.getCode(), status.getReason());

        if (removal.lastForIdentity()) {
            try {
                presenceService.markDisconnected(conn.identityId());
            } catch (RuntimeException ex) {
                log.warn("presence_disconnect_failed userId={}", conn.identityId(), ex);
            }
        }
    }

    void process(ConnectionInfo conn, InboundFrame frame) {
        if (!conn.isOpen()) return;
        conn.transition(ConnectionState.AUTHENTICATED_ACTIVE);
        try {
            if ("ping".equals(frame.event())) {
                presenceService.touch(conn.identityId());
                var pong = new LinkedHashMap<String, Object>();
                pong.put("pong", true);
                pong.put("timestamp", clock.instant());
                broadcaster.sendTo(conn, "pong", pong, frame.ackId());
            } else {
                dispatcher.dispatch(conn, frame);
            }
            metrics.messageHandled(conn.namespace());
        } catch (RateLimitExceededException ex) {
            broadcaster.sendTo(conn, "rateLimitExceeded", RateLimitExceededPayload.of(ex.result(), clock.instant()), frame.ackId());
        } catch (RealtimeException ex) {
            broadcaster.sendTo(conn, "error", ErrorPayload.of(ex.code(), ex.getMessage()), frame.ackId());
            if (ex.code().isCritical()) {
                log.info("ws_critical_error connectionId={} userId={} code={}", conn.connectionId(), conn.identityId(), ex.code().wire());
                closeQuietly(conn, CloseStatus.POLICY_VIOLATION.withReason(ex.code().wire()));
            }
        } catch (Exception ex) {
            log.warn("ws_internal_error connectionId={} userId={} event={}", conn.connectionId(), conn.identityId(), frame.event(), ex);
            broadcaster.sendTo(conn, "error", ErrorPayload.of(ErrorCode.INTERNAL, null), frame.ackId());
        } finally {
            if (conn.isOpen()) conn.transition(ConnectionState.AUTHENTICATED_IDLE);
        }
    }

    private InboundFrame parseFrame(String payload) {
        try {
            JsonNode root = objectMapper.readTree(payload);
            if (root == null || !root.isObject()) return null;
            var event = root.path("event").asText(null);
            if (event == null || event.isBlank()) return null;
            var ackId = root.hasNonNull("ackId") ? root.get("ackId").asText() : null;
            return new InboundFrame(event, root.get("data"), ackId);
        } catch (Exception ex) {
            return null;
        }
    }

    static void closeQuietly(ConnectionInfo conn, CloseStatus status) {
        try {
            if (conn.session().isOpen()) {
                conn.session().close(status);
            }
        } catch (Exception ex) {
            log.debug("ws_close_failed connectionId={}", conn.connectionId(), ex);
        }
    }
}
