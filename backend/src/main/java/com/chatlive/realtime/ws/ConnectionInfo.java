package com.chatlive.realtime.ws;

import com.chatlive.realtime.auth.service.Identity;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;

public class ConnectionInfo {

    private final String connectionId;
    private final Identity identity;
    private final Namespace namespace;
    private final WebSocketSession session;
    private final String clientIp;
    private final Instant connectedAt;
    private final ConnectionMailbox mailbox;
    private volatile Instant lastActivityAt;
    private volatile ConnectionState state;

    public ConnectionInfo(
            String connectionId,
            Identity identity,
            Namespace namespace,
            WebSocketSession session,
            String clientIp,
            Instant connectedAt,
            ConnectionMailbox mailbox
    ) {
        this.connectionId = connectionId;
        this.identity = identity;
        this.namespace = namespace;
        this.session = session;
        this.clientIp = clientIp;
        this.connectedAt = connectedAt;
        this.mailbox = mailbox;
        this.lastActivityAt = connectedAt;
        this.state = ConnectionState.AUTHENTICATING;
    }

    public String connectionId() {
        return connectionId;
    }

    public Identity identity() {
        return identity;
    }

    public String identityId() {
        return identity == null ? null : identity.id();
    }

    public Namespace namespace() {
        return namespace;
    }

    public WebSocketSession session() {
        return session;
    }

    public String clientIp() {
        return clientIp;
    }

    public Instant connectedAt() {
        return connectedAt;
    }

    public ConnectionMailbox mailbox() {
        return mailbox;
    }

    public Instant lastActivityAt() {
        return lastActivityAt;
    }

    public ConnectionState state() {
        return state;
    }

    public void touch(Instant now) {
        lastActivityAt = now;
    }

    public void transition(ConnectionState next) {
        state = next;
    }

    public boolean isOpen() {
        return state != ConnectionState.DISCONNECTED && session != null && session.isOpen();
    }
}
