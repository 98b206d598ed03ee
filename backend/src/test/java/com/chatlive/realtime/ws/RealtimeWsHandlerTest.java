package com.chatlive.realtime.ws;

import com.chatlive.realtime.auth.service.AuthException;
import com.chatlive.realtime.auth.service.Identity;
import com.chatlive.realtime.auth.service.PermissionSet;
import com.chatlive.realtime.auth.service.Role;
import com.chatlive.realtime.common.error.RealtimeException;
import com.chatlive.realtime.metrics.RealtimeMetrics;
import com.chatlive.realtime.presence.PresenceService;
import com.chatlive.realtime.testing.RecordingSession;
import com.chatlive.realtime.ws.backplane.LocalBackplane;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class RealtimeWsHandlerTest {

    private final ConnectionRegistry registry = new ConnectionRegistry();
    private final PresenceService presence = mock(PresenceService.class);
    private final List<String> dispatched = new ArrayList<>();
    private final ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json().build();
    private final Clock clock = Clock.systemUTC();
    private final WsBroadcaster broadcaster = new WsBroadcaster(objectMapper, registry, new LocalBackplane());
    private final RealtimeMetrics metrics = new RealtimeMetrics(new SimpleMeterRegistry(), registry, clock);
    private RealtimeWsHandler handler;

    @BeforeEach
    void setUp() {
        NamespaceDispatcher dispatcher = new NamespaceDispatcher() {
            @Override
            public Namespace namespace() {
                return Namespace.CHAT;
            }

            @Override
            public void onConnected(ConnectionInfo connection) {
                dispatched.add("connected:" + connection.identityId());
            }

            @Override
            public void dispatch(ConnectionInfo connection, InboundFrame frame) {
                dispatched.add(frame.event());
                switch (frame.event()) {
                    case "boom" -> throw new IllegalStateException("db exploded with secrets");
                    case "denied" -> throw RealtimeException.accessDenied("not_a_participant");
                    case "revoked" -> throw AuthException.expired();
                    case "echo" -> broadcaster.sendTo(connection, "echo", frame.data(), frame.ackId());
                    default -> throw RealtimeException.validation("unsupported_event");
                }
            }
        };
        handler = handlerWith(dispatcher, Runnable::run, null);
    }

    private RealtimeWsHandler handlerWith(NamespaceDispatcher dispatcher, Executor executor, Integer maxPendingFrames) {
        return new RealtimeWsHandler(dispatcher, registry, broadcaster, presence, metrics, objectMapper, executor, clock,
                new WsProperties(null, null, null, null, null, maxPendingFrames));
    }

    private static RecordingSession sessionOf(String userId, Role role) {
        var session = new RecordingSession("/ws/chat");
        session.getAttributes().put(WsAuthHandshakeInterceptor.ATTR_IDENTITY, new Identity(userId, role, PermissionSet.forRole(role)));
        return session;
    }

    private RecordingSession open(String userId, Role role) throws Exception {
        var session = sessionOf(userId, role);
        handler.afterConnectionEstablished(session);
        return session;
    }

    private static NamespaceDispatcher chatDispatcher(Runnable onConnected) {
        return new NamespaceDispatcher() {
            @Override
            public Namespace namespace() {
                return Namespace.CHAT;
            }

            @Override
            public void onConnected(ConnectionInfo connection) {
                onConnected.run();
            }

            @Override
            public void dispatch(ConnectionInfo connection, InboundFrame frame) {
            }
        };
    }

    @Test
    void connect_registers_and_greets() throws Exception {
        var session = open("u1", Role.USER);

        var connected = session.await("connected");
        assertThat(connected.path("data").path("userId").asText()).isEqualTo("u1");
        assertThat(connected.path("data").path("status").asText()).isEqualTo("online");
        assertThat(registry.subscribers(Namespace.CHAT, Channel.user("u1"))).hasSize(1);
        assertThat(dispatched).containsExactly("connected:u1");
        verify(presence).markConnected("u1");
    }

    @Test
    void missing_namespace_permission_closes_without_registering() throws Exception {
        var session = open("g1", Role.GUEST);

        assertThat(session.framesOf("error")).hasSize(1);
        assertThat(session.framesOf("error").get(0).path("data").path("code").asText()).isEqualTo("permission_denied");
        assertThat(session.isOpen()).isFalse();
        assertThat(registry.count()).isZero();
        verify(presence, never()).markConnected("g1");
    }

    @Test
    void unknown_event_reports_error_and_stays_open() throws Exception {
        var session = open("u2", Role.USER);

        handler.handleTextMessage(session, new TextMessage("{\"event\":\"teleport\",\"data\":{},\"ackId\":\"a1\"}"));

        var error = session.await("error");
        assertThat(error.path("data").path("message").asText()).isEqualTo("unsupported_event");
        assertThat(error.path("data").path("code").asText()).isEqualTo("validation_failed");
        assertThat(error.path("ackId").asText()).isEqualTo("a1");
        assertThat(session.isOpen()).isTrue();
    }

    @Test
    void malformed_frame_is_rejected() throws Exception {
        var session = open("u3", Role.USER);

        handler.handleTextMessage(session, new TextMessage("not json"));

        assertThat(session.await("error").path("data").path("message").asText()).isEqualTo("invalid_frame");
        assertThat(session.isOpen()).isTrue();
    }

    @Test
    void internal_error_is_generic() throws Exception {
        var session = open("u4", Role.USER);

        handler.handleTextMessage(session, new TextMessage("{\"event\":\"boom\"}"));

        var error = session.await("error");
        assertThat(error.path("data").path("code").asText()).isEqualTo("internal_error");
        assertThat(error.toString()).doesNotContain("secrets");
        assertThat(session.isOpen()).isTrue();
    }

    @Test
    void access_denied_keeps_connection_but_auth_failure_closes_it() throws Exception {
        var session = open("u5", Role.USER);

        handler.handleTextMessage(session, new TextMessage("{\"event\":\"denied\"}"));
        assertThat(session.await("error").path("data").path("code").asText()).isEqualTo("access_denied");
        assertThat(session.isOpen()).isTrue();

        handler.handleTextMessage(session, new TextMessage("{\"event\":\"revoked\"}"));
        assertThat(session.await("error", 2, Duration.ofSeconds(2)).path("data").path("code").asText()).isEqualTo("token_expired");
        assertThat(session.isOpen()).isFalse();
        assertThat(session.closeStatus().getCode()).isEqualTo(CloseStatus.POLICY_VIOLATION.getCode());
    }

    @Test
    void ping_is_answered_and_refreshes_presence() throws Exception {
        var session = open("u6", Role.USER);

        handler.handleTextMessage(session, new TextMessage("{\"event\":\"ping\",\"ackId\":\"p1\"}"));

        var pong = session.await("pong");
        assertThat(pong.path("data").path("pong").asBoolean()).isTrue();
        assertThat(pong.path("ackId").asText()).isEqualTo("p1");
        verify(presence).touch("u6");
    }

    @Test
    void last_close_marks_offline_but_not_earlier_ones() throws Exception {
        var first = open("u7", Role.USER);
        var second = open("u7", Role.USER);

        handler.afterConnectionClosed(first, CloseStatus.NORMAL);
        verify(presence, never()).markDisconnected("u7");

        handler.afterConnectionClosed(second, CloseStatus.NORMAL);
        verify(presence).markDisconnected("u7");
        assertThat(registry.connectionsOf("u7")).isEmpty();
    }

    @Test
    void frames_from_unregistered_sessions_close_them() throws Exception {
        var stray = new RecordingSession("/ws/chat");

        handler.handleTextMessage(stray, new TextMessage("{\"event\":\"echo\"}"));

        assertThat(stray.isOpen()).isFalse();
        assertThat(dispatched).isEmpty();
    }

    @Test
    void close_during_connect_setup_leaves_identity_offline() throws Exception {
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var pool = Executors.newSingleThreadExecutor();
        try {
            var slow = handlerWith(chatDispatcher(() -> {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }), pool, null);
            var session = sessionOf("u9", Role.USER);

            slow.afterConnectionEstablished(session);
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
            slow.afterConnectionClosed(session, CloseStatus.NORMAL);
            release.countDown();
            pool.shutdown();
            assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

            verify(presence).markDisconnected("u9");
            verify(presence, never()).markConnected("u9");
            assertThat(session.framesOf("connected")).isEmpty();
            assertThat(registry.count()).isZero();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void close_while_marking_connected_ends_offline() throws Exception {
        var session = sessionOf("u10", Role.USER);
        doAnswer(inv -> {
            handler.afterConnectionClosed(session, CloseStatus.GOING_AWAY);
            return null;
        }).when(presence).markConnected("u10");

        handler.afterConnectionEstablished(session);

        var order = inOrder(presence);
        order.verify(presence).markConnected("u10");
        order.verify(presence, times(2)).markDisconnected("u10");
        assertThat(session.framesOf("connected")).isEmpty();
    }

    @Test
    void inbound_backlog_over_the_cap_is_refused_with_an_error() throws Exception {
        var parked = new ArrayList<Runnable>();
        var backlogged = handlerWith(chatDispatcher(() -> {
        }), parked::add, 2);
        var session = sessionOf("u11", Role.USER);
        backlogged.afterConnectionEstablished(session);

        backlogged.handleMessage(session, new TextMessage("{\"event\":\"echo\",\"ackId\":\"a1\"}"));
        backlogged.handleMessage(session, new TextMessage("{\"event\":\"echo\",\"ackId\":\"a2\"}"));

        var error = session.await("error");
        assertThat(error.path("data").path("message").asText()).isEqualTo("too_many_pending_frames");
        assertThat(error.path("data").path("code").asText()).isEqualTo("validation_failed");
        assertThat(error.path("ackId").asText()).isEqualTo("a2");
        assertThat(registry.get(session.getId()).orElseThrow().mailbox().pending()).isEqualTo(2);
        assertThat(session.closeStatus()).isNull();
    }
}
