package com.chatlive.realtime.ws;

public enum ConnectionState {
    CONNECTING,
    AUTHENTICATING,
    AUTHENTICATED_IDLE,
    AUTHENTICATED_ACTIVE,
    DISCONNECTED;

    public boolean authenticated() {
        return this == AUTHENTICATED_IDLE || this == AUTHENTICATED_ACTIVE;
    }
}
