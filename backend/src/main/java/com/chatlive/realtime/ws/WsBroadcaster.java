package com.chatlive.realtime.ws;

import com.chatlive.realtime.ws.backplane.Backplane;
import com.chatlive.realtime.ws.backplane.BackplaneEnvelope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;

import java.io.IOException;

/**
 * Outbound side of the WebSocket layer. Channel broadcasts go to local subscribers first and
 * are then relayed through the {@link Backplane} so other processes deliver to theirs.
 */
@Component
public class WsBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(WsBroadcaster.class);

    private final ObjectMapper objectMapper;
    private final ConnectionRegistry registry;
    private final Backplane backplane;

    public WsBroadcaster(ObjectMapper objectMapper, ConnectionRegistry registry, Backplane backplane) {
        this.objectMapper = objectMapper;
        this.registry = registry;
        this.backplane = backplane;
    }

    @PostConstruct
    void listenToBackplane() {
        backplane.subscribe(this::onRemote);
    }

    public void broadcast(Namespace ns, Channel channel, String event, Object payload) {
        broadcastExceptIdentity(ns, channel, event, payload, null);
    }

    /**
     * Same as {@link #broadcast} but skips every connection of {@code excludeIdentityId}.
     */
    public void broadcastExceptIdentity(Namespace ns, Channel channel, String event, Object payload, String excludeIdentityId) {
        var frame = encode(event, payload, null);
        deliverLocal(ns, channel, frame, excludeIdentityId);
        backplane.publish(BackplaneEnvelope.event(backplane.nodeId(), ns.wire(), channel.key(), frame, excludeIdentityId));
    }

    public void sendToUser(Namespace ns, String userId, String event, Object payload) {
        broadcast(ns, Channel.user(userId), event, payload);
    }

    public void sendTo(ConnectionInfo conn, String event, Object payload) {
        sendTo(conn, event, payload, null);
    }

    public void sendTo(ConnectionInfo conn, String event, Object payload, String ackId) {
        if (conn == null) return;
        sendRaw(conn, encode(event, payload, ackId));
    }

    /**
     * Subscribes every connection the identity holds in {@code ns}, on every process, to {@code channel}.
     */
    public void joinEverywhere(Namespace ns, String identityId, Channel channel) {
        joinLocal(ns, identityId, channel);
        backplane.publish(BackplaneEnvelope.join(backplane.nodeId(), ns.wire(), channel.key(), identityId));
    }

    public int deliverLocal(Namespace ns, Channel channel, String frame, String excludeIdentityId) {
        var delivered = 0;
        for (var conn : registry.subscribers(ns, channel)) {
            if (excludeIdentityId != null && excludeIdentityId.equals(conn.identityId())) continue;
            if (sendRaw(conn, frame)) delivered++;
        }
        return delivered;
    }

    public String encode(String event, Object payload, String ackId) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("event", event);
        node.set("data", payload == null ? objectMapper.nullNode() : objectMapper.valueToTree(payload));
        if (ackId != null && !ackId.isBlank()) {
            node.put("ackId", ackId);
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("frame_encode_failed", ex);
        }
    }

    private void joinLocal(Namespace ns, String identityId, Channel channel) {
        for (var conn : registry.connectionsOf(identityId, ns)) {
            registry.join(channel, conn.connectionId());
        }
    }

    private void onRemote(BackplaneEnvelope envelope) {
        var ns = Namespace.fromWire(envelope.namespace()).orElse(null);
        if (ns == null) return;
        var channel = Channel.parse(envelope.channel());
        if (envelope.kind() == BackplaneEnvelope.Kind.JOIN) {
            joinLocal(ns, envelope.identityId(), channel);
        } else {
            deliverLocal(ns, channel, envelope.frame(), envelope.excludeIdentityId());
        }
    }

    private boolean sendRaw(ConnectionInfo conn, String frame) {
        if (!conn.isOpen()) return false;
        try {
            conn.session().sendMessage(new TextMessage(frame));
            return true;
        } catch (IOException | RuntimeException ex) {
            // The close callback cleans up the registry.
            log.debug("ws_send_failed connectionId={} userId={}", conn.connectionId(), conn.identityId(), ex);
            return false;
        }
    }
}
